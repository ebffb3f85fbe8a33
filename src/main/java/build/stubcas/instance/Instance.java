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

package build.stubcas.instance;

import build.bazel.remote.execution.v2.Digest;
import build.stubcas.common.Write;
import com.google.common.hash.HashCode;
import com.google.protobuf.ByteString;
import io.grpc.StatusException;
import java.util.List;
import java.util.Map;

/**
 * The protocol behavior behind the ByteStream and ContentAddressableStorage services. Every method
 * may be called concurrently.
 */
public interface Instance {
  String getName();

  /**
   * Resolves a read resource name to the ordered chunks of its blob. An empty blob has no chunks.
   */
  List<ByteString> read(String resourceName) throws StatusException;

  /** Begins a new write call. */
  Write newWrite();

  /** Returns the requested digests that are not stored, in request order. */
  List<Digest> findMissingBlobs(Iterable<Digest> digests) throws StatusException;

  long getReadRequestCount();

  /** The size of every write message received so far, in arrival order. */
  List<Integer> getWriteMessageSizes();

  Map<HashCode, ByteString> getBlobs();
}
