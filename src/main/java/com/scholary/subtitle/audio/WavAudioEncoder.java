package com.scholary.subtitle.audio;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import org.springframework.stereotype.Component;

/** Writes clips as 16-bit little-endian PCM WAV using javax.sound. */
@Component
public class WavAudioEncoder {

  public byte[] encode(AudioClip clip) throws IOException {
    AudioFormat format = new AudioFormat(clip.sampleRate(), 16, clip.channels(), true, false);
    byte[] pcm = clip.toPcm16Le();

    try (AudioInputStream stream =
            new AudioInputStream(new ByteArrayInputStream(pcm), format, clip.frameCount());
        ByteArrayOutputStream out = new ByteArrayOutputStream(pcm.length + 44)) {
      AudioSystem.write(stream, AudioFileFormat.Type.WAVE, out);
      return out.toByteArray();
    }
  }
}
