// Copyright 2026 The Buildfarm Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package build.stubcas.server;

import build.stubcas.common.config.StubCasConfigs;
import build.stubcas.common.config.StubCasOptions;
import build.stubcas.instance.memory.MemoryInstance;
import build.stubcas.metrics.prometheus.PrometheusPublisher;
import com.google.common.base.Strings;
import com.google.devtools.common.options.OptionsParser;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.file.FileSystems;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import lombok.extern.java.Log;

/** Runs a {@link StubCas} as a process until it is interrupted. */
@Log
public class StubCasServer {
  // held so that the level set on it is not lost to garbage collection
  private static final Logger nettyLogger = Logger.getLogger("io.grpc.netty");

  private final StubCasConfigs configs;
  private final HealthStatusManager healthStatusManager = new HealthStatusManager();
  private StubCas stubCas;

  public StubCasServer(StubCasConfigs configs) {
    this.configs = configs;
  }

  public void start() throws IOException {
    MemoryInstance instance =
        new MemoryInstance(
            configs.getServer().getName(),
            configs.getDigestUtil(),
            configs.getServer().getChunkSizeBytes(),
            configs.loadSeeds(FileSystems.getDefault()));

    String bindAddress = configs.getServer().getBindAddress();
    int port = configs.getServer().getPort();
    NettyServerBuilder serverBuilder =
        Strings.isNullOrEmpty(bindAddress)
            ? NettyServerBuilder.forPort(port)
            : NettyServerBuilder.forAddress(new InetSocketAddress(bindAddress, port));
    if (configs.getServer().getMaxInboundMessageSizeBytes() != 0) {
      serverBuilder.maxInboundMessageSize(configs.getServer().getMaxInboundMessageSizeBytes());
    }
    serverBuilder.addService(healthStatusManager.getHealthService());

    stubCas = new StubCas(instance, serverBuilder);
    healthStatusManager.setStatus(
        HealthStatusManager.SERVICE_NAME_ALL_SERVICES, ServingStatus.SERVING);
    PrometheusPublisher.startHttpServer(bindAddress, configs.getPrometheusPort());
    log.info(
        String.format(
            "%s serving %d blobs on %s with chunk size %d",
            instance.getName(),
            instance.getBlobs().size(),
            stubCas.address(),
            configs.getServer().getChunkSizeBytes()));
  }

  public void stop() {
    healthStatusManager.setStatus(
        HealthStatusManager.SERVICE_NAME_ALL_SERVICES, ServingStatus.NOT_SERVING);
    PrometheusPublisher.stopHttpServer();
    if (stubCas != null) {
      stubCas.close();
    }
  }

  public String address() {
    return stubCas.address();
  }

  private void blockUntilShutdown() throws InterruptedException {
    if (stubCas != null) {
      stubCas.awaitTermination();
    }
  }

  private static void readLoggingConfiguration() {
    if (System.getProperty("java.util.logging.config.file") != null) {
      return;
    }
    try (InputStream in = StubCasServer.class.getResourceAsStream("/logging.properties")) {
      if (in != null) {
        LogManager.getLogManager().readConfiguration(in);
      }
    } catch (IOException e) {
      log.log(Level.WARNING, "could not read logging.properties", e);
    }
  }

  public static void main(String[] args) throws Exception {
    readLoggingConfiguration();
    // Netty logs stream errors from misbehaving clients as warnings
    nettyLogger.setLevel(Level.SEVERE);

    OptionsParser parser = OptionsParser.newOptionsParser(StubCasOptions.class);
    StubCasConfigs configs = StubCasConfigs.loadServerConfigs(parser, args);
    if (parser.getOptions(StubCasOptions.class).help) {
      System.out.println(StubCasConfigs.usage(parser));
      return;
    }

    StubCasServer server = new StubCasServer(configs);
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  System.err.println("*** shutting down StubCAS since JVM is shutting down");
                  server.stop();
                  System.err.println("*** server shut down");
                }));
    server.start();
    server.blockUntilShutdown();
  }
}
