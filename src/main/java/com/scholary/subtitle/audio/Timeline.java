package com.scholary.subtitle.audio;

import java.util.Arrays;
import java.util.Locale;

/**
 * Append-only audio buffer with a cursor.
 *
 * <p>The cursor holds the declared end time of the last segment processed, in seconds. It is not
 * the length of the buffer: synthesized clips rarely match their subtitle slot, and the gap to
 * the next segment is measured from the cursor.
 *
 * <p>The buffer is capped at {@code maxSeconds}; growing past it throws {@link
 * TimelineTooLongException} before anything is allocated.
 *
 * <p>Not thread-safe. A timeline belongs to one synthesis run.
 */
public class Timeline {

  private static final int INITIAL_CAPACITY = 1 << 16;

  private final int sampleRate;
  private final int channels;
  private final long maxSamples;
  private final int maxSeconds;

  private short[] buffer = new short[INITIAL_CAPACITY];
  private int size;
  private double cursor;

  public Timeline(int sampleRate, int channels, int maxSeconds) {
    if (sampleRate <= 0 || channels <= 0 || maxSeconds <= 0) {
      throw new IllegalArgumentException(
          "Sample rate, channel count and maximum length must be positive");
    }
    this.sampleRate = sampleRate;
    this.channels = channels;
    this.maxSeconds = maxSeconds;
    this.maxSamples = Math.min((long) maxSeconds * sampleRate * channels, Integer.MAX_VALUE - 8);
  }

  /**
   * Append silence, truncated to whole milliseconds.
   *
   * @param seconds the silence length; zero or negative appends nothing
   * @return the number of frames appended
   * @throws TimelineTooLongException if the track would exceed its maximum length
   */
  public long appendSilence(double seconds) {
    if (!(seconds > 0)) {
      return 0;
    }
    if (seconds > maxSeconds) {
      throw tooLong(durationSeconds() + seconds);
    }
    long millis = (long) (seconds * 1000);
    long frames = millis * sampleRate / 1000;
    ensureCapacity(frames * channels);
    // new slots are already zero
    size += (int) (frames * channels);
    return frames;
  }

  /**
   * Append a clip directly after the current end of the buffer.
   *
   * @throws IllegalArgumentException if the clip's format differs from the timeline's
   * @throws TimelineTooLongException if the track would exceed its maximum length
   */
  public void append(AudioClip clip) {
    if (clip.sampleRate() != sampleRate || clip.channels() != channels) {
      throw new IllegalArgumentException(
          String.format(
              "Clip format %dHz/%dch does not match timeline %dHz/%dch",
              clip.sampleRate(), clip.channels(), sampleRate, channels));
    }
    short[] samples = clip.samples();
    ensureCapacity(samples.length);
    System.arraycopy(samples, 0, buffer, size, samples.length);
    size += samples.length;
  }

  public double cursor() {
    return cursor;
  }

  public void moveCursor(double seconds) {
    this.cursor = seconds;
  }

  public long frameCount() {
    return size / channels;
  }

  public double durationSeconds() {
    return (double) frameCount() / sampleRate;
  }

  public int sampleRate() {
    return sampleRate;
  }

  public int channels() {
    return channels;
  }

  /** Snapshot of everything appended so far. */
  public AudioClip toClip() {
    return new AudioClip(Arrays.copyOf(buffer, size), sampleRate, channels);
  }

  private void ensureCapacity(long additional) {
    long required = size + additional;
    if (required > maxSamples) {
      throw tooLong((double) required / channels / sampleRate);
    }
    if (required > buffer.length) {
      long grown = Math.max(required, (long) buffer.length * 2);
      buffer = Arrays.copyOf(buffer, (int) Math.min(grown, maxSamples));
    }
  }

  private TimelineTooLongException tooLong(double seconds) {
    return new TimelineTooLongException(
        String.format(
            Locale.ROOT,
            "Voice track would reach %.3fs, over the %ds limit", seconds, maxSeconds));
  }
}
