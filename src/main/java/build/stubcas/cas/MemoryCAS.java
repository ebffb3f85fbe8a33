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

package build.stubcas.cas;

import static com.google.common.base.Preconditions.checkNotNull;

import build.bazel.remote.execution.v2.Digest;
import build.stubcas.common.DigestUtil;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.hash.HashCode;
import com.google.protobuf.ByteString;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import javax.annotation.concurrent.GuardedBy;
import lombok.extern.java.Log;

/** An unbounded in-memory store. Entries are never expired or removed. */
@Log
public class MemoryCAS implements ContentAddressableStorage {
  @GuardedBy("this")
  private final Map<HashCode, ByteString> storage = Maps.newHashMap();

  @GuardedBy("this")
  private long sizeInBytes = 0;

  @Override
  public synchronized ByteString get(HashCode fingerprint) {
    return storage.get(fingerprint);
  }

  @Override
  public synchronized boolean contains(HashCode fingerprint) {
    return storage.containsKey(fingerprint);
  }

  @Override
  public synchronized void put(HashCode fingerprint, ByteString blob) {
    checkNotNull(blob);
    ByteString previous = storage.put(fingerprint, blob);
    if (previous != null) {
      sizeInBytes -= previous.size();
    }
    sizeInBytes += blob.size();
    log.log(
        Level.FINER,
        String.format(
            "stored %s (%d bytes), %d blobs in %d bytes",
            fingerprint, blob.size(), storage.size(), sizeInBytes));
  }

  @Override
  public synchronized void putAll(Map<HashCode, ByteString> blobs) {
    for (Map.Entry<HashCode, ByteString> entry : blobs.entrySet()) {
      put(entry.getKey(), entry.getValue());
    }
  }

  @Override
  public synchronized List<Digest> findMissingBlobs(
      Iterable<Digest> digests, DigestUtil digestUtil) {
    ImmutableList.Builder<Digest> missing = ImmutableList.builder();
    for (Digest digest : digests) {
      if (!storage.containsKey(digestUtil.fingerprint(digest))) {
        missing.add(digest);
      }
    }
    return missing.build();
  }

  @Override
  public synchronized Map<HashCode, ByteString> snapshot() {
    return ImmutableMap.copyOf(storage);
  }

  public synchronized long size() {
    return sizeInBytes;
  }
}
