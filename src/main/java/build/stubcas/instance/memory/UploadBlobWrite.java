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

package build.stubcas.instance.memory;

import static build.stubcas.common.resources.UrlPath.parseUploadBlobHash;
import static build.stubcas.common.resources.UrlPath.parseUploadBlobSize;
import static com.google.common.base.Preconditions.checkState;
import static io.grpc.Status.INTERNAL;
import static io.grpc.Status.INVALID_ARGUMENT;
import static java.lang.String.format;

import build.stubcas.cas.ContentAddressableStorage;
import build.stubcas.common.DigestUtil;
import build.stubcas.common.Write;
import build.stubcas.common.resources.UrlPath.InvalidResourceNameException;
import com.google.common.hash.HashCode;
import com.google.protobuf.ByteString;
import io.grpc.StatusException;
import java.util.function.IntConsumer;
import java.util.logging.Level;
import lombok.extern.java.Log;

/**
 * Accumulates an upload of a single blob and inserts it into storage on a successful commit.
 *
 * <p>Every message is counted through {@code onMessage}. Consistency of the resource name and
 * offsets is checked per message; the first inconsistency is held and later messages are only
 * counted. Resource name structure, declared size and the always fail mode are checked at commit,
 * in that order.
 */
@Log
class UploadBlobWrite implements Write {
  private final DigestUtil digestUtil;
  private final ContentAddressableStorage storage;
  private final IntConsumer onMessage;
  private final boolean alwaysFail;

  private String name = null;
  private long nextOffset = 0;
  private ByteString content = ByteString.EMPTY;
  private StatusException failure = null;
  private boolean committed = false;

  UploadBlobWrite(
      DigestUtil digestUtil,
      ContentAddressableStorage storage,
      IntConsumer onMessage,
      boolean alwaysFail) {
    this.digestUtil = digestUtil;
    this.storage = storage;
    this.onMessage = onMessage;
    this.alwaysFail = alwaysFail;
  }

  @Override
  public void append(String resourceName, long offset, ByteString data) {
    checkState(!committed, "write has already been committed");
    onMessage.accept(data.size());
    if (failure != null) {
      return;
    }
    if (name == null) {
      name = resourceName;
    } else if (!name.equals(resourceName)) {
      failure =
          INVALID_ARGUMENT
              .withDescription(
                  format(
                      "All resource names in stream must be the same. Got %s but earlier saw %s",
                      resourceName, name))
              .asException();
      return;
    }
    if (offset != nextOffset) {
      failure =
          INVALID_ARGUMENT
              .withDescription(
                  format(
                      "Missing chunk. Expected next offset %d, got next offset: %d",
                      nextOffset, offset))
              .asException();
      return;
    }
    nextOffset += data.size();
    content = content.concat(data);
  }

  @Override
  public long commit() throws StatusException {
    checkState(!committed, "write has already been committed");
    committed = true;
    if (failure != null) {
      throw failure;
    }
    if (name == null) {
      throw INVALID_ARGUMENT.withDescription("Stream saw no messages").asException();
    }

    String hash;
    long size;
    try {
      hash = parseUploadBlobHash(name);
    } catch (InvalidResourceNameException e) {
      throw INVALID_ARGUMENT.withDescription(e.getMessage()).asException();
    }
    HashCode fingerprint;
    try {
      fingerprint = digestUtil.parseFingerprint(hash);
    } catch (IllegalArgumentException e) {
      throw INVALID_ARGUMENT
          .withDescription(
              format("Bad fingerprint in resource name: %s: %s", hash, e.getMessage()))
          .asException();
    }
    try {
      size = parseUploadBlobSize(name);
    } catch (InvalidResourceNameException e) {
      throw INVALID_ARGUMENT.withDescription(e.getMessage()).asException();
    }
    if (size != content.size()) {
      throw INVALID_ARGUMENT
          .withDescription(
              format(
                  "Size was incorrect: resource name said size=%d but got %d",
                  size, content.size()))
          .asException();
    }

    if (alwaysFail) {
      throw INTERNAL.withDescription(MemoryInstance.ALWAYS_FAIL_MESSAGE).asException();
    }

    storage.put(fingerprint, content);
    log.log(Level.FINER, format("committed %s/%d for %s", fingerprint, size, name));
    return size;
  }

  @Override
  public long getCommittedSize() {
    return content.size();
  }

  @Override
  public String getName() {
    return name;
  }
}
