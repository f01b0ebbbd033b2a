package com.scholary.subtitle.storage;

import java.nio.file.Path;

/**
 * A caller-supplied location, either a local path or an {@code s3://bucket/key} object.
 *
 * <p>Exactly one of {@code localPath} and ({@code bucket}, {@code key}) is set.
 */
public record StorageLocation(Path localPath, String bucket, String key) {

  private static final String S3_SCHEME = "s3://";

  public static StorageLocation parse(String location) {
    if (location == null || location.isBlank()) {
      throw new IllegalArgumentException("Location must not be blank");
    }
    if (!location.startsWith(S3_SCHEME)) {
      return new StorageLocation(Path.of(location), null, null);
    }

    String rest = location.substring(S3_SCHEME.length());
    int slash = rest.indexOf('/');
    if (slash <= 0 || slash == rest.length() - 1) {
      throw new IllegalArgumentException("Expected s3://bucket/key but got: " + location);
    }
    return new StorageLocation(null, rest.substring(0, slash), rest.substring(slash + 1));
  }

  public boolean isObject() {
    return localPath == null;
  }

  @Override
  public String toString() {
    return isObject() ? S3_SCHEME + bucket + "/" + key : localPath.toString();
  }
}
