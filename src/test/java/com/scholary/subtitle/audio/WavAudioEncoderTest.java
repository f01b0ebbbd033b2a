package com.scholary.subtitle.audio;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayInputStream;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import org.junit.jupiter.api.Test;

class WavAudioEncoderTest {

  private final WavAudioEncoder encoder = new WavAudioEncoder();

  @Test
  void encode_shouldWriteRiffWaveHeader() throws Exception {
    byte[] wav = encoder.encode(AudioClip.silence(100, 16000, 1));

    assertThat(new String(wav, 0, 4, "US-ASCII")).isEqualTo("RIFF");
    assertThat(new String(wav, 8, 4, "US-ASCII")).isEqualTo("WAVE");
    assertThat(wav.length).isEqualTo(44 + 200);
  }

  @Test
  void encode_shouldPreserveFormatAndSamples() throws Exception {
    AudioClip clip = new AudioClip(new short[] {1, -1, 300, -300, 32767, -32768}, 22050, 2);

    byte[] wav = encoder.encode(clip);

    try (AudioInputStream in = AudioSystem.getAudioInputStream(new ByteArrayInputStream(wav))) {
      AudioFormat format = in.getFormat();
      assertThat(format.getSampleRate()).isEqualTo(22050f);
      assertThat(format.getChannels()).isEqualTo(2);
      assertThat(format.getSampleSizeInBits()).isEqualTo(16);
      assertThat(in.getFrameLength()).isEqualTo(3);

      AudioClip decoded = AudioClip.fromPcm16Le(in.readAllBytes(), 22050, 2);
      assertThat(decoded).isEqualTo(clip);
    }
  }

  @Test
  void encode_shouldHandleEmptyClip() throws Exception {
    byte[] wav = encoder.encode(AudioClip.silence(0, 24000, 1));

    assertThat(wav.length).isEqualTo(44);
  }
}
