package com.scholary.subtitle.subtitle;

import com.scholary.subtitle.exception.SubtitleFormatException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between seconds and subtitle timestamps.
 *
 * <p>Format: HH:MM:SS,mmm. Hours are zero-padded to two digits but not wrapped at 24.
 *
 * <p>Milliseconds are truncated, not rounded: {@code encode(1.2399)} gives {@code ,239}. The
 * truncation works on the decimal value of the double, so millisecond-aligned inputs such as
 * {@code 3661.234} survive {@code decode(encode(t)) == t} exactly.
 */
public final class TimestampCodec {

  private static final Pattern TIMESTAMP_PATTERN =
      Pattern.compile("(\\d+):(\\d{2}):(\\d{2}),(\\d{3})");

  private static final double MAX_SECONDS = Long.MAX_VALUE / 1000.0;

  private TimestampCodec() {}

  /**
   * Format seconds as a subtitle timestamp.
   *
   * @param seconds a finite, non-negative time in seconds
   * @return the timestamp text
   * @throws IllegalArgumentException if seconds is negative, NaN or infinite
   */
  public static String encode(double seconds) {
    if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
      throw new IllegalArgumentException("Timestamp must be finite: " + seconds);
    }
    if (seconds < 0) {
      throw new IllegalArgumentException("Timestamp cannot be negative: " + seconds);
    }
    if (seconds >= MAX_SECONDS) {
      throw new IllegalArgumentException("Timestamp too large: " + seconds);
    }

    long totalMillis =
        BigDecimal.valueOf(seconds)
            .setScale(3, RoundingMode.DOWN)
            .movePointRight(3)
            .longValueExact();

    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;

    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }

  /**
   * Parse a subtitle timestamp into seconds.
   *
   * @param timestamp text of the form {@code H+:MM:SS,mmm}
   * @return the time in seconds
   * @throws SubtitleFormatException if the text does not match the timestamp grammar
   */
  public static double decode(String timestamp) {
    if (timestamp == null) {
      throw new SubtitleFormatException("Timestamp is missing");
    }
    Matcher matcher = TIMESTAMP_PATTERN.matcher(timestamp);
    if (!matcher.matches()) {
      throw new SubtitleFormatException("Malformed timestamp: '" + timestamp + "'");
    }

    try {
      long hours = Long.parseLong(matcher.group(1));
      long minutes = Long.parseLong(matcher.group(2));
      long secs = Long.parseLong(matcher.group(3));
      long millis = Long.parseLong(matcher.group(4));

      long totalMillis =
          Math.addExact(
              Math.multiplyExact(hours, 3_600_000L), minutes * 60_000L + secs * 1000L + millis);
      return totalMillis / 1000.0;
    } catch (NumberFormatException | ArithmeticException e) {
      throw new SubtitleFormatException("Timestamp out of range: '" + timestamp + "'", e);
    }
  }
}
