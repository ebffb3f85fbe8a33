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

package build.stubcas.common.resources;

import com.google.common.base.Strings;
import java.util.UUID;

/**
 * Parses and formats ByteStream resource names.
 *
 * <p>Both grammars split on {@code /} with a fixed limit, so any further {@code /} characters end
 * up in the final component.
 */
public class UrlPath {
  public static class InvalidResourceNameException extends Exception {
    private final String resourceName;

    public InvalidResourceNameException(String resourceName, String message) {
      super(message);
      this.resourceName = resourceName;
    }

    public InvalidResourceNameException(String resourceName, String message, Throwable cause) {
      super(message, cause);
      this.resourceName = resourceName;
    }

    public String getResourceName() {
      return resourceName;
    }
  }

  private static final int BLOB_COMPONENTS = 4;
  private static final int UPLOAD_BLOB_COMPONENTS = 6;

  private static String[] blobComponents(String resourceName)
      throws InvalidResourceNameException {
    // /blobs/{hash}/{size}
    String[] components = resourceName.split("/", BLOB_COMPONENTS);
    if (components.length != BLOB_COMPONENTS
        || !components[0].isEmpty()
        || !components[1].equals("blobs")) {
      throw new InvalidResourceNameException(
          resourceName,
          String.format(
              "Bad resource name format %s - want /blobs/some-sha256/size", resourceName));
    }
    return components;
  }

  private static String[] uploadBlobComponents(String resourceName)
      throws InvalidResourceNameException {
    // {prefix}/uploads/{upload_id}/blobs/{hash}/{size}
    String[] components = resourceName.split("/", UPLOAD_BLOB_COMPONENTS);
    if (components.length != UPLOAD_BLOB_COMPONENTS
        || !components[1].equals("uploads")
        || !components[3].equals("blobs")) {
      throw new InvalidResourceNameException(
          resourceName, String.format("Bad resource name: %s", resourceName));
    }
    return components;
  }

  /** Returns the hex hash component of a read resource name. */
  public static String parseBlobHash(String resourceName) throws InvalidResourceNameException {
    return blobComponents(resourceName)[2];
  }

  /** Returns the hex hash component of an upload resource name. */
  public static String parseUploadBlobHash(String resourceName)
      throws InvalidResourceNameException {
    return uploadBlobComponents(resourceName)[4];
  }

  /** Returns the declared size of an upload resource name, which must be non-negative. */
  public static long parseUploadBlobSize(String resourceName)
      throws InvalidResourceNameException {
    String component = uploadBlobComponents(resourceName)[5];
    long size;
    try {
      size = Long.parseLong(component);
    } catch (NumberFormatException e) {
      throw new InvalidResourceNameException(
          resourceName,
          String.format("Bad size in resource name: %s: %s", component, e.getMessage()),
          e);
    }
    if (size < 0) {
      throw new InvalidResourceNameException(
          resourceName,
          String.format("Bad size in resource name: %s: size must not be negative", component));
    }
    return size;
  }

  public static String blobName(String hash, long size) {
    return String.format("/blobs/%s/%d", hash, size);
  }

  public static String uploadBlobName(String prefix, UUID uuid, String hash, long size) {
    return String.format(
        "%s/uploads/%s/blobs/%s/%d", Strings.nullToEmpty(prefix), uuid, hash, size);
  }
}
