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

import build.bazel.remote.execution.v2.Digest;
import build.bazel.remote.execution.v2.DigestFunction;
import com.google.common.base.Ascii;
import com.google.common.hash.Funnels;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.protobuf.ByteString;
import com.google.protobuf.Message;
import java.io.IOException;
import lombok.Getter;

/**
 * Utility methods to work with {@link Digest}s and the fingerprints they name.
 *
 * <p>A fingerprint is the fixed-width {@link HashCode} of a blob's content. Its canonical text
 * form is lowercase hex, as it appears in resource names and in {@link Digest#getHash()}.
 */
public class DigestUtil {
  /** Type of hash function to use for digesting blobs. */
  // The underlying HashFunctions are immutable and thread safe.
  @SuppressWarnings("ImmutableEnumChecker")
  public enum HashFunction {
    @SuppressWarnings("deprecation")
    MD5(Hashing.md5(), DigestFunction.Value.MD5),
    @SuppressWarnings("deprecation")
    SHA1(Hashing.sha1(), DigestFunction.Value.SHA1),
    SHA256(Hashing.sha256(), DigestFunction.Value.SHA256),
    SHA384(Hashing.sha384(), DigestFunction.Value.SHA384),
    SHA512(Hashing.sha512(), DigestFunction.Value.SHA512);

    @Getter private final com.google.common.hash.HashFunction hash;
    @Getter private final DigestFunction.Value digestFunction;

    HashFunction(com.google.common.hash.HashFunction hash, DigestFunction.Value digestFunction) {
      this.hash = hash;
      this.digestFunction = digestFunction;
    }

    public static HashFunction get(DigestFunction.Value digestFunction) {
      switch (digestFunction) {
        case SHA256:
          return SHA256;
        case SHA384:
          return SHA384;
        case SHA512:
          return SHA512;
        case SHA1:
          return SHA1;
        case MD5:
          return MD5;
        default:
          throw new IllegalArgumentException(digestFunction.toString());
      }
    }

    public boolean isValidHexDigest(String hexDigest) {
      return hexDigest != null && hexDigest.length() * 8 / 2 == hash.bits();
    }
  }

  private final HashFunction hashFn;

  public DigestUtil(HashFunction hashFn) {
    this.hashFn = hashFn;
  }

  public DigestFunction.Value getDigestFunction() {
    return hashFn.getDigestFunction();
  }

  public HashCode computeHash(ByteString blob) {
    Hasher hasher = hashFn.getHash().newHasher();
    try {
      blob.writeTo(Funnels.asOutputStream(hasher));
    } catch (IOException e) {
      /* impossible, due to Funnels.asOutputStream behavior */
    }
    return hasher.hash();
  }

  public Digest compute(ByteString blob) {
    return build(computeHash(blob), blob.size());
  }

  /**
   * Computes a digest of the given proto message from its serialized form. The result names the
   * blob that a client would upload for the message.
   */
  public Digest compute(Message message) {
    return compute(message.toByteString());
  }

  /**
   * Decodes the hex text of a fingerprint. Upper case hex digits are accepted and normalized.
   *
   * @throws NumberFormatException if the text is not a hex hash of this function's width
   */
  public HashCode parseFingerprint(String hexHash) {
    if (!hashFn.isValidHexDigest(hexHash)) {
      throw new NumberFormatException(
          String.format("[%s] is not a valid %s hash.", hexHash, hashFn.name()));
    }
    try {
      return HashCode.fromString(Ascii.toLowerCase(hexHash));
    } catch (IllegalArgumentException e) {
      NumberFormatException nfe =
          new NumberFormatException(
              String.format(
                  "[%s] is not a valid %s hash: %s", hexHash, hashFn.name(), e.getMessage()));
      nfe.initCause(e);
      throw nfe;
    }
  }

  public HashCode fingerprint(Digest digest) {
    return parseFingerprint(digest.getHash());
  }

  public Digest build(HashCode fingerprint, long size) {
    return Digest.newBuilder().setHash(fingerprint.toString()).setSizeBytes(size).build();
  }

  public static String toString(Digest digest) {
    return String.format("%s/%d", digest.getHash(), digest.getSizeBytes());
  }
}
