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

import build.bazel.remote.execution.v2.Directory;
import build.stubcas.common.DigestUtil;
import build.stubcas.common.services.ByteStreamService;
import build.stubcas.common.services.ContentAddressableStorageService;
import build.stubcas.instance.Instance;
import build.stubcas.instance.memory.MemoryInstance;
import com.google.common.collect.ImmutableMap;
import com.google.common.hash.HashCode;
import com.google.common.net.HostAndPort;
import com.google.protobuf.ByteString;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.netty.NettyServerBuilder;
import io.grpc.util.TransmitStatusRuntimeExceptionInterceptor;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.extern.java.Log;

/**
 * A running ByteStream and ContentAddressableStorage server backed by memory, for exercising
 * remote cache clients.
 *
 * <p>The factories bind {@code localhost}. A negative chunk size makes every read, write and
 * missing blobs query fail with INTERNAL.
 */
@Log
public class StubCas implements AutoCloseable {
  static final String INSTANCE_NAME = "stubcas";
  static final long DEFAULT_CHUNK_SIZE_BYTES = 1024;

  private static final DigestUtil DIGEST_UTIL = new DigestUtil(DigestUtil.HashFunction.SHA256);

  private final Instance instance;
  private final Server server;

  public StubCas(Instance instance, ServerBuilder<?> serverBuilder) throws IOException {
    this.instance = instance;
    server =
        serverBuilder
            .addService(new ByteStreamService(instance))
            .addService(new ContentAddressableStorageService(instance))
            .intercept(TransmitStatusRuntimeExceptionInterceptor.instance())
            .build()
            .start();
    log.fine(
        String.format(
            "StubCAS %s listening on %s", instance.getName(), server.getListenSockets()));
  }

  /** Serves {@code blobs} under the given keys without checking that they match the content. */
  public static StubCas withUnverifiedContentAndPort(
      long chunkSizeBytes, Map<HashCode, ByteString> blobs, int port) throws IOException {
    return new StubCas(
        new MemoryInstance(INSTANCE_NAME, DIGEST_UTIL, chunkSizeBytes, blobs),
        NettyServerBuilder.forAddress(new InetSocketAddress("localhost", port)));
  }

  public static StubCas withUnverifiedContent(long chunkSizeBytes, Map<HashCode, ByteString> blobs)
      throws IOException {
    return withUnverifiedContentAndPort(chunkSizeBytes, blobs, 0);
  }

  /**
   * Serves each file under its fingerprint, and each directory under the fingerprint of its
   * serialized form.
   */
  public static StubCas withContent(
      long chunkSizeBytes, Iterable<ByteString> files, Iterable<Directory> directories)
      throws IOException {
    Map<HashCode, ByteString> blobs = new HashMap<>();
    for (ByteString file : files) {
      blobs.put(DIGEST_UTIL.computeHash(file), file);
    }
    for (Directory directory : directories) {
      ByteString content = directory.toByteString();
      blobs.put(DIGEST_UTIL.computeHash(content), content);
    }
    return withUnverifiedContent(chunkSizeBytes, blobs);
  }

  public static StubCas empty() throws IOException {
    return emptyWithPort(0);
  }

  public static StubCas emptyWithPort(int port) throws IOException {
    return withUnverifiedContentAndPort(DEFAULT_CHUNK_SIZE_BYTES, ImmutableMap.of(), port);
  }

  public static StubCas alwaysErrors() throws IOException {
    return withUnverifiedContent(-1, ImmutableMap.of());
  }

  /** Returns the {@code host:port} of the first listening socket. */
  public String address() {
    List<? extends SocketAddress> sockets = server.getListenSockets();
    if (sockets.isEmpty() || !(sockets.get(0) instanceof InetSocketAddress)) {
      throw new IllegalStateException("StubCAS is not listening on a network socket");
    }
    InetSocketAddress socket = (InetSocketAddress) sockets.get(0);
    return HostAndPort.fromParts(socket.getHostString(), socket.getPort()).toString();
  }

  public long readRequestCount() {
    return instance.getReadRequestCount();
  }

  public List<Integer> writeMessageSizes() {
    return instance.getWriteMessageSizes();
  }

  public Map<HashCode, ByteString> blobs() {
    return instance.getBlobs();
  }

  public void awaitTermination() throws InterruptedException {
    server.awaitTermination();
  }

  @Override
  public void close() {
    server.shutdownNow();
    try {
      if (!server.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warning("StubCAS " + instance.getName() + " did not terminate in time");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
