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

import static build.stubcas.common.resources.UrlPath.parseBlobHash;
import static com.google.common.base.Preconditions.checkArgument;
import static io.grpc.Status.INTERNAL;
import static io.grpc.Status.INVALID_ARGUMENT;
import static io.grpc.Status.NOT_FOUND;
import static java.lang.String.format;

import build.bazel.remote.execution.v2.Digest;
import build.stubcas.cas.ContentAddressableStorage;
import build.stubcas.cas.MemoryCAS;
import build.stubcas.common.DigestUtil;
import build.stubcas.common.Write;
import build.stubcas.common.resources.UrlPath.InvalidResourceNameException;
import build.stubcas.instance.Instance;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.HashCode;
import com.google.protobuf.ByteString;
import io.grpc.StatusException;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import lombok.extern.java.Log;

/**
 * Answers requests from an in-memory store.
 *
 * <p>The chunk size bounds the bytes of each read response. A negative chunk size puts the
 * instance in always fail mode: reads fail with INTERNAL before the store is consulted, writes
 * fail with INTERNAL once the stream has passed every structural check, and missing blob queries
 * fail with INTERNAL outright.
 */
@Log
public class MemoryInstance implements Instance {
  static final String ALWAYS_FAIL_MESSAGE = "StubCAS is configured to always fail";

  private final String name;
  private final DigestUtil digestUtil;
  private final long chunkSizeBytes;
  private final ContentAddressableStorage storage;
  private final RequestCounters counters = new RequestCounters();

  public MemoryInstance(
      String name, DigestUtil digestUtil, long chunkSizeBytes, Map<HashCode, ByteString> blobs) {
    this(name, digestUtil, chunkSizeBytes, new MemoryCAS());
    storage.putAll(blobs);
  }

  public MemoryInstance(
      String name,
      DigestUtil digestUtil,
      long chunkSizeBytes,
      ContentAddressableStorage storage) {
    checkArgument(chunkSizeBytes != 0, "chunk size must not be zero");
    this.name = name;
    this.digestUtil = digestUtil;
    this.chunkSizeBytes = chunkSizeBytes;
    this.storage = storage;
  }

  boolean shouldAlwaysFail() {
    return chunkSizeBytes < 0;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public List<ByteString> read(String resourceName) throws StatusException {
    // counted whether or not the request is valid
    counters.incrementReadRequests();

    String hash;
    try {
      hash = parseBlobHash(resourceName);
    } catch (InvalidResourceNameException e) {
      throw INVALID_ARGUMENT.withDescription(e.getMessage()).asException();
    }
    HashCode fingerprint;
    try {
      fingerprint = digestUtil.parseFingerprint(hash);
    } catch (IllegalArgumentException e) {
      throw INVALID_ARGUMENT
          .withDescription(format("Bad digest %s: %s", hash, e.getMessage()))
          .asException();
    }
    if (shouldAlwaysFail()) {
      throw INTERNAL.withDescription(ALWAYS_FAIL_MESSAGE).asException();
    }

    ByteString blob = storage.get(fingerprint);
    if (blob == null) {
      throw NOT_FOUND.withDescription(format("Did not find digest %s", fingerprint)).asException();
    }
    return chunks(blob, (int) Math.min(chunkSizeBytes, Integer.MAX_VALUE));
  }

  static List<ByteString> chunks(ByteString blob, int chunkSize) {
    checkArgument(chunkSize > 0, "chunk size must be positive");
    ImmutableList.Builder<ByteString> chunks = ImmutableList.builder();
    for (int offset = 0; offset < blob.size(); offset += chunkSize) {
      chunks.add(blob.substring(offset, Math.min(blob.size(), offset + chunkSize)));
    }
    return chunks.build();
  }

  @Override
  public Write newWrite() {
    return new UploadBlobWrite(
        digestUtil, storage, counters::recordWriteMessage, shouldAlwaysFail());
  }

  @Override
  public List<Digest> findMissingBlobs(Iterable<Digest> digests) throws StatusException {
    if (shouldAlwaysFail()) {
      throw INTERNAL.withDescription(ALWAYS_FAIL_MESSAGE).asException();
    }
    try {
      return storage.findMissingBlobs(digests, digestUtil);
    } catch (IllegalArgumentException e) {
      // clients are expected to only send digests of the configured function
      log.log(Level.SEVERE, format("findMissingBlobs(%s): bad digest", name), e);
      throw INTERNAL
          .withDescription(format("Bad digest: %s", e.getMessage()))
          .withCause(e)
          .asException();
    }
  }

  @Override
  public long getReadRequestCount() {
    return counters.getReadRequestCount();
  }

  @Override
  public List<Integer> getWriteMessageSizes() {
    return counters.getWriteMessageSizes();
  }

  @Override
  public Map<HashCode, ByteString> getBlobs() {
    return storage.snapshot();
  }
}
