package com.scholary.subtitle.exception;

/**
 * Thrown when a timestamp or subtitle block does not match the expected grammar.
 *
 * <p>Surfaced to callers of {@code TimestampCodec.decode}. The parser catches it per block and
 * skips the block.
 */
public class SubtitleFormatException extends SubtitleEngineException {

  public SubtitleFormatException(String message) {
    super(message);
  }

  public SubtitleFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
