package com.scholary.subtitle.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A temporary file that is deleted when the scope closes.
 *
 * <p>Use with try-with-resources so the file goes away on success, on a recovered per-segment
 * failure and on a fatal failure alike.
 */
public final class ScopedTempFile implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScopedTempFile.class);

  private final Path path;

  private ScopedTempFile(Path path) {
    this.path = path;
  }

  /**
   * Create an empty temporary file.
   *
   * @param directory the parent directory, created if missing
   * @param prefix file name prefix
   * @param suffix file name suffix, including the dot
   */
  public static ScopedTempFile create(Path directory, String prefix, String suffix)
      throws IOException {
    Files.createDirectories(directory);
    return new ScopedTempFile(Files.createTempFile(directory, prefix, suffix));
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() {
    try {
      if (Files.deleteIfExists(path)) {
        LOGGER.debug("Deleted temp file: {}", path);
      }
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file: {}", path, e);
    }
  }
}
