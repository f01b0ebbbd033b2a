package com.scholary.subtitle.audio;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ContainerFormatTest {

  @Test
  void forDestination_shouldPickFormatFromExtension() {
    assertThat(ContainerFormat.forDestination("/out/voice.mp3")).isEqualTo(ContainerFormat.MP3);
    assertThat(ContainerFormat.forDestination("/out/voice.wav")).isEqualTo(ContainerFormat.WAV);
    assertThat(ContainerFormat.forDestination("s3://bucket/a/voice.WAV"))
        .isEqualTo(ContainerFormat.WAV);
  }

  @Test
  void forDestination_shouldFallBackToMp3() {
    assertThat(ContainerFormat.forDestination("/out/voice.ogg")).isEqualTo(ContainerFormat.MP3);
    assertThat(ContainerFormat.forDestination("/out/voice")).isEqualTo(ContainerFormat.MP3);
    assertThat(ContainerFormat.forDestination("/out.wav/voice")).isEqualTo(ContainerFormat.MP3);
    assertThat(ContainerFormat.forDestination(null)).isEqualTo(ContainerFormat.MP3);
  }

  @Test
  void isSupported_shouldOnlyAcceptKnownExtensions() {
    assertThat(ContainerFormat.isSupported("C:\\audio\\track.Mp3")).isTrue();
    assertThat(ContainerFormat.isSupported("track.flac")).isFalse();
    assertThat(ContainerFormat.isSupported("track")).isFalse();
  }

  @Test
  void contentType_shouldMatchFormat() {
    assertThat(ContainerFormat.MP3.contentType()).isEqualTo("audio/mpeg");
    assertThat(ContainerFormat.WAV.contentType()).isEqualTo("audio/wav");
  }
}
