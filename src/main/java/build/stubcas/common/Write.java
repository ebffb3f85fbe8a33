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

package build.stubcas.common;

import com.google.protobuf.ByteString;
import io.grpc.StatusException;
import javax.annotation.Nullable;

/**
 * The state of a single ByteStream write call. Messages are appended in the order they arrive and
 * the whole stream is validated and stored by {@link #commit()} once the client half-closes.
 *
 * <p>Implementations are not thread safe; a write belongs to exactly one call.
 */
public interface Write {
  /**
   * Accepts the next message of the stream. A message that is inconsistent with the stream so far
   * does not throw here; the failure is held and reported by {@link #commit()}.
   */
  void append(String resourceName, long offset, ByteString data);

  /**
   * Validates the accumulated stream and stores the blob it describes.
   *
   * @return the committed size of the blob
   * @throws StatusException with the status the call should fail with, in which case nothing was
   *     stored
   */
  long commit() throws StatusException;

  /** The number of bytes accepted so far. */
  long getCommittedSize();

  /** The resource name declared by the first message, or null if none has arrived. */
  @Nullable
  String getName();
}
