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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import build.bazel.remote.execution.v2.ContentAddressableStorageGrpc;
import build.bazel.remote.execution.v2.ContentAddressableStorageGrpc.ContentAddressableStorageBlockingStub;
import build.bazel.remote.execution.v2.Digest;
import build.bazel.remote.execution.v2.Directory;
import build.bazel.remote.execution.v2.FileNode;
import build.bazel.remote.execution.v2.FindMissingBlobsRequest;
import build.stubcas.common.DigestUtil;
import build.stubcas.common.DigestUtil.HashFunction;
import build.stubcas.common.resources.UrlPath;
import com.google.bytestream.ByteStreamGrpc;
import com.google.bytestream.ByteStreamProto.ReadRequest;
import com.google.bytestream.ByteStreamProto.ReadResponse;
import com.google.bytestream.ByteStreamProto.WriteRequest;
import com.google.bytestream.ByteStreamProto.WriteResponse;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.SettableFuture;
import com.google.protobuf.ByteString;
import io.grpc.ManagedChannel;
import io.grpc.Status;
import io.grpc.Status.Code;
import io.grpc.StatusRuntimeException;
import io.grpc.netty.NettyChannelBuilder;
import io.grpc.stub.StreamObserver;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.After;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class StubCasTest {
  private static final DigestUtil DIGEST_UTIL = new DigestUtil(HashFunction.SHA256);
  private static final ByteString HELLO = ByteString.copyFromUtf8("hello");
  private static final Digest HELLO_DIGEST = DIGEST_UTIL.compute(HELLO);

  private final List<ManagedChannel> channels = new ArrayList<>();

  @After
  public void tearDown() throws Exception {
    for (ManagedChannel channel : channels) {
      channel.shutdownNow();
      channel.awaitTermination(10, TimeUnit.SECONDS);
    }
  }

  private ManagedChannel connect(StubCas stubCas) {
    ManagedChannel channel =
        NettyChannelBuilder.forTarget(stubCas.address()).usePlaintext().build();
    channels.add(channel);
    return channel;
  }

  private static List<ByteString> read(ManagedChannel channel, Digest digest) {
    Iterator<ReadResponse> responses =
        ByteStreamGrpc.newBlockingStub(channel)
            .read(
                ReadRequest.newBuilder()
                    .setResourceName(UrlPath.blobName(digest.getHash(), digest.getSizeBytes()))
                    .build());
    List<ByteString> chunks = new ArrayList<>();
    while (responses.hasNext()) {
      chunks.add(responses.next().getData());
    }
    return chunks;
  }

  private static long write(ManagedChannel channel, ByteString content, int chunkSize)
      throws Exception {
    Digest digest = DIGEST_UTIL.compute(content);
    String resourceName =
        UrlPath.uploadBlobName("", UUID.randomUUID(), digest.getHash(), digest.getSizeBytes());
    SettableFuture<WriteResponse> future = SettableFuture.create();
    StreamObserver<WriteRequest> requestObserver =
        ByteStreamGrpc.newStub(channel)
            .write(
                new StreamObserver<WriteResponse>() {
                  @Override
                  public void onNext(WriteResponse response) {
                    future.set(response);
                  }

                  @Override
                  public void onError(Throwable t) {
                    future.setException(t);
                  }

                  @Override
                  public void onCompleted() {}
                });
    int offset = 0;
    do {
      int end = Math.min(content.size(), offset + chunkSize);
      requestObserver.onNext(
          WriteRequest.newBuilder()
              .setResourceName(resourceName)
              .setWriteOffset(offset)
              .setData(content.substring(offset, end))
              .setFinishWrite(end == content.size())
              .build());
      offset = end;
    } while (offset < content.size());
    requestObserver.onCompleted();
    return future.get(10, TimeUnit.SECONDS).getCommittedSize();
  }

  @Test
  public void emptyServesUploadsOnLocalhost() throws Exception {
    try (StubCas stubCas = StubCas.empty()) {
      assertThat(stubCas.address()).matches(".+:[1-9]\\d*");
      ManagedChannel channel = connect(stubCas);

      assertThat(write(channel, HELLO, 2)).isEqualTo(5);

      assertThat(stubCas.writeMessageSizes()).containsExactly(2, 2, 1).inOrder();
      assertThat(stubCas.blobs()).containsExactly(DIGEST_UTIL.computeHash(HELLO), HELLO);
      assertThat(read(channel, HELLO_DIGEST)).containsExactly(HELLO);
      assertThat(stubCas.readRequestCount()).isEqualTo(1);
    }
  }

  @Test
  public void byteStreamRoundTripOverTheWire() throws Exception {
    assertThat(ByteStreamGrpc.SERVICE_NAME).isEqualTo("google.bytestream.ByteStream");
    try (StubCas stubCas = StubCas.withUnverifiedContent(2, ImmutableMap.of())) {
      ManagedChannel channel = connect(stubCas);

      StatusRuntimeException notFound =
          assertThrows(StatusRuntimeException.class, () -> read(channel, HELLO_DIGEST));
      assertThat(notFound.getStatus().getCode()).isEqualTo(Code.NOT_FOUND);

      assertThat(write(channel, HELLO, 5)).isEqualTo(5);
      assertThat(read(channel, HELLO_DIGEST))
          .containsExactly(
              ByteString.copyFromUtf8("he"),
              ByteString.copyFromUtf8("ll"),
              ByteString.copyFromUtf8("o"))
          .inOrder();

      ByteString other = ByteString.copyFromUtf8("abcd");
      Digest otherDigest = DIGEST_UTIL.compute(other);
      String resourceName =
          UrlPath.uploadBlobName("", UUID.randomUUID(), otherDigest.getHash(), 4);
      SettableFuture<WriteResponse> future = SettableFuture.create();
      StreamObserver<WriteRequest> requestObserver =
          ByteStreamGrpc.newStub(channel)
              .write(
                  new StreamObserver<WriteResponse>() {
                    @Override
                    public void onNext(WriteResponse response) {
                      future.set(response);
                    }

                    @Override
                    public void onError(Throwable t) {
                      future.setException(t);
                    }

                    @Override
                    public void onCompleted() {}
                  });
      for (String data : ImmutableList.of("ab", "cd")) {
        // the offset is repeated on the second request
        requestObserver.onNext(
            WriteRequest.newBuilder()
                .setResourceName(resourceName)
                .setWriteOffset(0)
                .setData(ByteString.copyFromUtf8(data))
                .build());
      }
      requestObserver.onCompleted();

      ExecutionException e =
          assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
      assertThat(Status.fromThrowable(e.getCause()).getCode()).isEqualTo(Code.INVALID_ARGUMENT);
      assertThat(stubCas.blobs()).doesNotContainKey(DIGEST_UTIL.computeHash(other));
      assertThat(stubCas.writeMessageSizes()).containsExactly(5, 2, 2).inOrder();
    }
  }

  @Test
  public void withUnverifiedContentServesGivenKeys() throws Exception {
    ByteString other = ByteString.copyFromUtf8("world");
    try (StubCas stubCas =
        StubCas.withUnverifiedContent(2, ImmutableMap.of(DIGEST_UTIL.computeHash(HELLO), other))) {
      assertThat(read(connect(stubCas), HELLO_DIGEST))
          .containsExactly(
              ByteString.copyFromUtf8("wo"),
              ByteString.copyFromUtf8("rl"),
              ByteString.copyFromUtf8("d"))
          .inOrder();
    }
  }

  @Test
  public void withContentComputesFingerprints() throws Exception {
    Directory directory =
        Directory.newBuilder()
            .addFiles(FileNode.newBuilder().setName("hello").setDigest(HELLO_DIGEST).build())
            .build();
    Digest directoryDigest = DIGEST_UTIL.compute(directory);
    Digest absent = DIGEST_UTIL.compute(ByteString.copyFromUtf8("absent"));

    try (StubCas stubCas =
        StubCas.withContent(1024, ImmutableList.of(HELLO), ImmutableList.of(directory))) {
      ContentAddressableStorageBlockingStub cas =
          ContentAddressableStorageGrpc.newBlockingStub(connect(stubCas));

      List<Digest> missing =
          cas.findMissingBlobs(
                  FindMissingBlobsRequest.newBuilder()
                      .addBlobDigests(absent)
                      .addBlobDigests(HELLO_DIGEST)
                      .addBlobDigests(directoryDigest)
                      .build())
              .getMissingBlobDigestsList();

      assertThat(missing).containsExactly(absent);
      assertThat(stubCas.blobs()).hasSize(2);
    }
  }

  @Test
  public void alwaysErrorsFailsEveryCall() throws Exception {
    try (StubCas stubCas = StubCas.alwaysErrors()) {
      ManagedChannel channel = connect(stubCas);

      StatusRuntimeException readError =
          assertThrows(StatusRuntimeException.class, () -> read(channel, HELLO_DIGEST));
      assertThat(readError.getStatus().getCode()).isEqualTo(Code.INTERNAL);

      ExecutionException writeError =
          assertThrows(ExecutionException.class, () -> write(channel, HELLO, 1024));
      assertThat(Status.fromThrowable(writeError.getCause()).getCode())
          .isEqualTo(Code.INTERNAL);

      StatusRuntimeException findError =
          assertThrows(
              StatusRuntimeException.class,
              () ->
                  ContentAddressableStorageGrpc.newBlockingStub(channel)
                      .findMissingBlobs(
                          FindMissingBlobsRequest.newBuilder()
                              .addBlobDigests(HELLO_DIGEST)
                              .build()));
      assertThat(findError.getStatus().getCode()).isEqualTo(Code.INTERNAL);

      assertThat(stubCas.readRequestCount()).isEqualTo(1);
      assertThat(stubCas.writeMessageSizes()).containsExactly(5);
      assertThat(stubCas.blobs()).isEmpty();
    }
  }

  @Test
  public void concurrentWritesOfDistinctBlobsAllLand() throws Exception {
    try (StubCas stubCas = StubCas.empty()) {
      ManagedChannel channel = connect(stubCas);
      List<Thread> threads = new ArrayList<>();
      List<Throwable> failures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        ByteString content = ByteString.copyFromUtf8("concurrent blob " + i);
        threads.add(
            new Thread(
                () -> {
                  try {
                    write(channel, content, 4);
                  } catch (Exception e) {
                    synchronized (failures) {
                      failures.add(e);
                    }
                  }
                }));
      }
      threads.forEach(Thread::start);
      for (Thread thread : threads) {
        thread.join();
      }

      assertThat(failures).isEmpty();
      assertThat(stubCas.blobs()).hasSize(8);
    }
  }

  @Test
  public void blobsIsSnapshot() throws Exception {
    try (StubCas stubCas = StubCas.empty()) {
      assertThat(stubCas.blobs()).isEmpty();
      write(connect(stubCas), HELLO, 1024);
      assertThat(stubCas.blobs()).hasSize(1);
      assertThrows(UnsupportedOperationException.class, () -> stubCas.blobs().clear());
    }
  }
}
