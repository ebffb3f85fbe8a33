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

import build.bazel.remote.execution.v2.Digest;
import build.stubcas.common.DigestUtil;
import com.google.common.hash.HashCode;
import com.google.protobuf.ByteString;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * A mapping from fingerprint to blob content. Content is not verified against its fingerprint.
 */
public interface ContentAddressableStorage {
  /** Returns the content stored for the fingerprint, or null if there is none. */
  @Nullable
  ByteString get(HashCode fingerprint);

  boolean contains(HashCode fingerprint);

  /** Stores the content under the fingerprint, replacing any previous content. */
  void put(HashCode fingerprint, ByteString blob);

  void putAll(Map<HashCode, ByteString> blobs);

  /**
   * Returns the digests whose fingerprints are not present, in request order.
   *
   * @throws NumberFormatException if any digest hash is not a valid fingerprint for {@code
   *     digestUtil}
   */
  List<Digest> findMissingBlobs(Iterable<Digest> digests, DigestUtil digestUtil);

  /** An immutable copy of the current contents. */
  Map<HashCode, ByteString> snapshot();
}
