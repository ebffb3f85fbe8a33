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

package build.stubcas.common.services;

import static io.grpc.Status.UNIMPLEMENTED;
import static java.lang.String.format;
import static java.util.concurrent.TimeUnit.MICROSECONDS;

import build.bazel.remote.execution.v2.BatchUpdateBlobsRequest;
import build.bazel.remote.execution.v2.BatchUpdateBlobsResponse;
import build.bazel.remote.execution.v2.ContentAddressableStorageGrpc;
import build.bazel.remote.execution.v2.Digest;
import build.bazel.remote.execution.v2.FindMissingBlobsRequest;
import build.bazel.remote.execution.v2.FindMissingBlobsResponse;
import build.bazel.remote.execution.v2.GetTreeRequest;
import build.bazel.remote.execution.v2.GetTreeResponse;
import build.stubcas.instance.Instance;
import com.google.common.base.Stopwatch;
import io.grpc.Status;
import io.grpc.Status.Code;
import io.grpc.stub.StreamObserver;
import io.prometheus.client.Histogram;
import java.util.List;
import java.util.logging.Level;
import lombok.extern.java.Log;

@Log
public class ContentAddressableStorageService
    extends ContentAddressableStorageGrpc.ContentAddressableStorageImplBase {
  private static final Histogram missingBlobs =
      Histogram.build().name("missing_blobs").help("Find missing blobs.").register();

  private final Instance instance;

  public ContentAddressableStorageService(Instance instance) {
    this.instance = instance;
  }

  @Override
  public void findMissingBlobs(
      FindMissingBlobsRequest request, StreamObserver<FindMissingBlobsResponse> responseObserver) {
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      List<Digest> missing = instance.findMissingBlobs(request.getBlobDigestsList());
      responseObserver.onNext(
          FindMissingBlobsResponse.newBuilder().addAllMissingBlobDigests(missing).build());
      responseObserver.onCompleted();
      long elapsedMicros = stopwatch.elapsed(MICROSECONDS);
      missingBlobs.observe(request.getBlobDigestsCount());
      log.log(
          Level.FINE,
          format(
              "FindMissingBlobs(%s) for %d blobs (%d missing) in %.3fms",
              instance.getName(),
              request.getBlobDigestsCount(),
              missing.size(),
              elapsedMicros / 1000.0));
    } catch (Exception e) {
      Status status = Status.fromThrowable(e);
      if (status.getCode() != Code.CANCELLED) {
        log.log(
            Level.WARNING,
            format(
                "findMissingBlobs(%s): %d: %s",
                request.getInstanceName(), request.getBlobDigestsCount(), status));
        responseObserver.onError(status.asException());
      }
    }
  }

  @Override
  public void batchUpdateBlobs(
      BatchUpdateBlobsRequest request, StreamObserver<BatchUpdateBlobsResponse> responseObserver) {
    responseObserver.onError(
        UNIMPLEMENTED.withDescription("batchUpdateBlobs is not supported").asException());
  }

  @Override
  public void getTree(GetTreeRequest request, StreamObserver<GetTreeResponse> responseObserver) {
    responseObserver.onError(UNIMPLEMENTED.withDescription("getTree is not supported").asException());
  }
}
