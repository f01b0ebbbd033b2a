package com.scholary.subtitle.audio;

import com.scholary.subtitle.exception.ExternalServiceException;
import java.io.IOException;
import org.springframework.stereotype.Component;

/** Routes each container format to the encoder that writes it. */
@Component
public class ContainerAudioEncoder implements AudioEncoder {

  private final WavAudioEncoder wavEncoder;
  private final FfmpegAudioCodec ffmpegCodec;

  public ContainerAudioEncoder(WavAudioEncoder wavEncoder, FfmpegAudioCodec ffmpegCodec) {
    this.wavEncoder = wavEncoder;
    this.ffmpegCodec = ffmpegCodec;
  }

  @Override
  public byte[] encode(AudioClip clip, ContainerFormat format) {
    switch (format) {
      case WAV:
        try {
          return wavEncoder.encode(clip);
        } catch (IOException e) {
          throw new ExternalServiceException("Failed to encode WAV", e);
        }
      case MP3:
        return ffmpegCodec.encodeMp3(clip);
      default:
        throw new IllegalArgumentException("Unsupported container format: " + format);
    }
  }
}
