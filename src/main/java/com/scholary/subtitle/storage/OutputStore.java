package com.scholary.subtitle.storage;

import com.scholary.subtitle.exception.ResourceException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads inputs from and writes finished outputs to caller-supplied locations.
 *
 * <p>Local files are written to a sibling temporary file first and then moved into place, so a
 * destination is never left half-written. {@code s3://bucket/key} locations go through the
 * {@link ObjectStoreClient} when object storage is enabled.
 */
@Component
public class OutputStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputStore.class);

  private final Optional<ObjectStoreClient> objectStoreClient;

  public OutputStore(Optional<ObjectStoreClient> objectStoreClient) {
    this.objectStoreClient = objectStoreClient;
  }

  /**
   * Write the complete content to a destination, replacing anything already there.
   *
   * @throws ResourceException if the destination cannot be written
   */
  public void write(String destination, byte[] content, String contentType) {
    StorageLocation location = parse(destination);

    if (location.isObject()) {
      requireObjectStore(location)
          .putObject(location.bucket(), location.key(), content, contentType);
      return;
    }

    Path target = location.localPath().toAbsolutePath();
    Path tmp = null;
    try {
      Path parent = target.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      tmp = Files.createTempFile(parent, "." + target.getFileName(), ".part");
      Files.write(tmp, content);
      try {
        Files.move(
            tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      LOGGER.info("Wrote {} bytes to {}", content.length, target);
    } catch (IOException e) {
      deleteQuietly(tmp);
      throw new ResourceException("Failed to write " + destination + ": " + e.getMessage(), e);
    }
  }

  /**
   * Read a UTF-8 text file or object.
   *
   * @throws ResourceException if the location cannot be read
   */
  public String readText(String source) {
    StorageLocation location = parse(source);

    if (location.isObject()) {
      try (InputStream in =
          requireObjectStore(location).getObjectStream(location.bucket(), location.key())) {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
      } catch (IOException e) {
        throw new ResourceException("Failed to read " + source + ": " + e.getMessage(), e);
      }
    }

    try {
      return Files.readString(location.localPath(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ResourceException("Failed to read " + source + ": " + e.getMessage(), e);
    }
  }

  private StorageLocation parse(String location) {
    try {
      return StorageLocation.parse(location);
    } catch (IllegalArgumentException e) {
      throw new ResourceException(e.getMessage(), e);
    }
  }

  private ObjectStoreClient requireObjectStore(StorageLocation location) {
    return objectStoreClient.orElseThrow(
        () ->
            new ResourceException(
                "Object storage is disabled, cannot access " + location));
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temporary file {}: {}", path, e.getMessage());
    }
  }
}
