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

import build.stubcas.instance.Instance;
import com.google.bytestream.ByteStreamGrpc.ByteStreamImplBase;
import com.google.bytestream.ByteStreamProto.QueryWriteStatusRequest;
import com.google.bytestream.ByteStreamProto.QueryWriteStatusResponse;
import com.google.bytestream.ByteStreamProto.ReadRequest;
import com.google.bytestream.ByteStreamProto.ReadResponse;
import com.google.bytestream.ByteStreamProto.WriteRequest;
import com.google.bytestream.ByteStreamProto.WriteResponse;
import com.google.protobuf.ByteString;
import io.grpc.Status;
import io.grpc.Status.Code;
import io.grpc.StatusException;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import io.prometheus.client.Counter;
import java.util.List;
import java.util.logging.Level;
import lombok.extern.java.Log;

@Log
public class ByteStreamService extends ByteStreamImplBase {
  private static final Counter reads =
      Counter.build()
          .name("bytestream_reads")
          .labelNames("code")
          .help("ByteStream reads by status code.")
          .register();

  private final Instance instance;

  public ByteStreamService(Instance instance) {
    this.instance = instance;
  }

  @Override
  public void read(ReadRequest request, StreamObserver<ReadResponse> responseObserver) {
    String resourceName = request.getResourceName();
    log.log(
        Level.FINEST,
        format(
            "read resource_name=%s offset=%d limit=%d",
            resourceName, request.getReadOffset(), request.getReadLimit()));

    List<ByteString> chunks;
    try {
      chunks = instance.read(resourceName);
    } catch (StatusException e) {
      Status status = e.getStatus();
      reads.labels(status.getCode().name()).inc();
      if (status.getCode() != Code.NOT_FOUND) {
        log.log(Level.WARNING, format("error reading %s: %s", resourceName, status));
      }
      responseObserver.onError(e);
      return;
    }

    long responseBytes = 0;
    try {
      for (ByteString chunk : chunks) {
        responseObserver.onNext(ReadResponse.newBuilder().setData(chunk).build());
        responseBytes += chunk.size();
      }
      responseObserver.onCompleted();
      reads.labels(Code.OK.name()).inc();
    } catch (StatusRuntimeException e) {
      // the client went away, there is no one left to tell
      reads.labels(e.getStatus().getCode().name()).inc();
      log.log(
          Level.FINE,
          format(
              "read of %s ended after %d bytes of content: %s",
              resourceName, responseBytes, e.getStatus()));
    }
  }

  @Override
  public void queryWriteStatus(
      QueryWriteStatusRequest request, StreamObserver<QueryWriteStatusResponse> responseObserver) {
    log.log(Level.FINER, format("queryWriteStatus(%s)", request.getResourceName()));
    responseObserver.onError(
        UNIMPLEMENTED.withDescription("resumable uploads are not supported").asException());
  }

  @Override
  public StreamObserver<WriteRequest> write(StreamObserver<WriteResponse> responseObserver) {
    return new WriteStreamObserver(instance.getName(), instance.newWrite(), responseObserver);
  }
}
