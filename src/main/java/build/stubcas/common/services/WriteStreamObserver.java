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

import static java.lang.String.format;

import build.stubcas.common.Write;
import com.google.bytestream.ByteStreamProto.WriteRequest;
import com.google.bytestream.ByteStreamProto.WriteResponse;
import io.grpc.Status;
import io.grpc.Status.Code;
import io.grpc.StatusException;
import io.grpc.stub.StreamObserver;
import io.prometheus.client.Counter;
import java.util.logging.Level;
import javax.annotation.concurrent.GuardedBy;
import lombok.extern.java.Log;

/**
 * Feeds the requests of one write call into a {@link Write} and delivers its outcome when the
 * client half-closes. Exactly one of a response or an error is delivered, unless the client
 * cancels first, in which case the write is abandoned.
 */
@Log
class WriteStreamObserver implements StreamObserver<WriteRequest> {
  private static final Counter writes =
      Counter.build()
          .name("bytestream_writes")
          .labelNames("code")
          .help("ByteStream writes by status code.")
          .register();

  private final String instanceName;
  private final Write write;
  private final StreamObserver<WriteResponse> responseObserver;

  @GuardedBy("this")
  private long requestCount = 0;

  @GuardedBy("this")
  private boolean done = false;

  WriteStreamObserver(
      String instanceName, Write write, StreamObserver<WriteResponse> responseObserver) {
    this.instanceName = instanceName;
    this.write = write;
    this.responseObserver = responseObserver;
  }

  @Override
  public synchronized void onNext(WriteRequest request) {
    if (done) {
      return;
    }
    requestCount++;
    log.log(
        Level.FINER,
        format(
            "writing %d to %s at %d%s",
            request.getData().size(),
            request.getResourceName(),
            request.getWriteOffset(),
            request.getFinishWrite() ? " with finish_write" : ""));
    write.append(request.getResourceName(), request.getWriteOffset(), request.getData());
  }

  @Override
  public synchronized void onError(Throwable t) {
    if (done) {
      return;
    }
    done = true;
    Status status = Status.fromThrowable(t);
    writes.labels(status.getCode().name()).inc();
    log.log(
        status.getCode() == Code.CANCELLED ? Level.FINE : Level.WARNING,
        format(
            "abandoning write of %s(%s) after %d requests and %d bytes",
            write.getName(), instanceName, requestCount, write.getCommittedSize()),
        t);
  }

  @Override
  public synchronized void onCompleted() {
    if (done) {
      return;
    }
    done = true;
    long committedSize;
    try {
      committedSize = write.commit();
    } catch (StatusException e) {
      Status status = e.getStatus();
      writes.labels(status.getCode().name()).inc();
      log.log(
          Level.WARNING,
          format(
              "error writing %s(%s) after %d requests: %s",
              write.getName(), instanceName, requestCount, status));
      responseObserver.onError(e);
      return;
    }
    writes.labels(Code.OK.name()).inc();
    log.log(
        Level.FINE,
        format(
            "delivering committed_size for %s(%s) of %d",
            write.getName(), instanceName, committedSize));
    responseObserver.onNext(WriteResponse.newBuilder().setCommittedSize(committedSize).build());
    responseObserver.onCompleted();
  }
}
