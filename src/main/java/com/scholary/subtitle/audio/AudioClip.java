package com.scholary.subtitle.audio;

import java.util.Arrays;

/**
 * Immutable block of 16-bit signed PCM audio.
 *
 * <p>Samples are interleaved by channel. Duration is derived from the frame count and the sample
 * rate.
 */
public final class AudioClip {

  private final short[] samples;
  private final int sampleRate;
  private final int channels;

  public AudioClip(short[] samples, int sampleRate, int channels) {
    if (sampleRate <= 0) {
      throw new IllegalArgumentException("Sample rate must be positive");
    }
    if (channels <= 0) {
      throw new IllegalArgumentException("Channel count must be positive");
    }
    if (samples.length % channels != 0) {
      throw new IllegalArgumentException(
          String.format(
              "Sample count %d is not a multiple of channel count %d", samples.length, channels));
    }
    this.samples = samples.clone();
    this.sampleRate = sampleRate;
    this.channels = channels;
  }

  /** A clip of {@code frames} frames of digital silence. */
  public static AudioClip silence(long frames, int sampleRate, int channels) {
    return new AudioClip(new short[Math.toIntExact(frames * channels)], sampleRate, channels);
  }

  public short[] samples() {
    return samples.clone();
  }

  public int sampleRate() {
    return sampleRate;
  }

  public int channels() {
    return channels;
  }

  public long frameCount() {
    return samples.length / channels;
  }

  public boolean isEmpty() {
    return samples.length == 0;
  }

  public double durationSeconds() {
    return (double) frameCount() / sampleRate;
  }

  /** Raw PCM bytes, 16-bit signed little-endian. */
  public byte[] toPcm16Le() {
    byte[] pcm = new byte[samples.length * 2];
    for (int i = 0; i < samples.length; i++) {
      pcm[2 * i] = (byte) (samples[i] & 0xFF);
      pcm[2 * i + 1] = (byte) ((samples[i] >>> 8) & 0xFF);
    }
    return pcm;
  }

  /** Build a clip from 16-bit signed little-endian PCM. A trailing odd byte is dropped. */
  public static AudioClip fromPcm16Le(byte[] pcm, int sampleRate, int channels) {
    int sampleCount = pcm.length / 2;
    sampleCount -= sampleCount % channels;
    short[] samples = new short[sampleCount];
    for (int i = 0; i < sampleCount; i++) {
      samples[i] = (short) ((pcm[2 * i] & 0xFF) | (pcm[2 * i + 1] << 8));
    }
    return new AudioClip(samples, sampleRate, channels);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof AudioClip other)) {
      return false;
    }
    return sampleRate == other.sampleRate
        && channels == other.channels
        && Arrays.equals(samples, other.samples);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * sampleRate + channels) + Arrays.hashCode(samples);
  }

  @Override
  public String toString() {
    return String.format(
        "AudioClip[frames=%d, sampleRate=%d, channels=%d, duration=%.3fs]",
        frameCount(), sampleRate, channels, durationSeconds());
  }
}
