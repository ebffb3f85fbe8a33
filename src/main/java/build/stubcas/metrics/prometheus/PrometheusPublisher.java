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

package build.stubcas.metrics.prometheus;

import com.google.common.base.Strings;
import io.prometheus.client.exporter.HTTPServer;
import io.prometheus.client.hotspot.DefaultExports;
import java.io.IOException;
import java.net.InetSocketAddress;
import javax.annotation.Nullable;
import lombok.extern.java.Log;

/** Serves the default registry, which holds the service counters, over HTTP. */
@Log
public class PrometheusPublisher {
  private static HTTPServer server;

  /** Starts the endpoint when {@code port} is positive. Returns whether it is running. */
  public static synchronized boolean startHttpServer(@Nullable String bindAddress, int port) {
    if (port <= 0) {
      log.info("Prometheus port is not configured. HTTP Server will not be started");
      return false;
    }
    if (server != null) {
      log.warning("Prometheus HTTP Server is already running on port " + server.getPort());
      return true;
    }
    try {
      DefaultExports.initialize();
      InetSocketAddress address =
          Strings.isNullOrEmpty(bindAddress)
              ? new InetSocketAddress(port)
              : new InetSocketAddress(bindAddress, port);
      server =
          new HTTPServer.Builder()
              .withInetSocketAddress(address)
              .withDaemonThreads(true)
              .build();
      log.info("Started Prometheus HTTP Server on port " + server.getPort());
      return true;
    } catch (IOException e) {
      log.severe("Could not start Prometheus HTTP Server on port " + port + ": " + e);
      return false;
    }
  }

  public static synchronized void stopHttpServer() {
    if (server != null) {
      server.close();
      server = null;
    }
  }
}
