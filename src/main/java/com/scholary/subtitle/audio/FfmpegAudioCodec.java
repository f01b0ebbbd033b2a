package com.scholary.subtitle.audio;

import com.scholary.subtitle.config.EngineProperties;
import com.scholary.subtitle.exception.ExternalServiceException;
import com.scholary.subtitle.media.FfmpegProperties;
import com.scholary.subtitle.media.ProcessRunner;
import com.scholary.subtitle.storage.ScopedTempFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Audio decoding and MP3 encoding through the ffmpeg command-line tool.
 *
 * <p>Decoding always goes to raw s16le at the requested rate and channel count, so clips from
 * backends that speak different formats (MP3 from HTTP services, WAV from espeak) can be appended
 * to one timeline. MP3 encoding goes through a temporary WAV written by {@link WavAudioEncoder}.
 */
@Component
public class FfmpegAudioCodec implements AudioDecoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioCodec.class);

  private final FfmpegProperties properties;
  private final ProcessRunner processRunner;
  private final WavAudioEncoder wavEncoder;
  private final Path tempDir;

  public FfmpegAudioCodec(
      FfmpegProperties properties,
      ProcessRunner processRunner,
      WavAudioEncoder wavEncoder,
      EngineProperties engineProperties) {
    this.properties = properties;
    this.processRunner = processRunner;
    this.wavEncoder = wavEncoder;
    this.tempDir = Paths.get(engineProperties.tempDir());
  }

  @Override
  public AudioClip decode(Path audioFile, int sampleRate, int channels) {
    try (ScopedTempFile raw = ScopedTempFile.create(tempDir, "decode_", ".pcm")) {
      List<String> command =
          List.of(
              properties.ffmpegPath(),
              "-v", "error",
              "-i", audioFile.toString(),
              "-f", "s16le",
              "-acodec", "pcm_s16le",
              "-ar", String.valueOf(sampleRate),
              "-ac", String.valueOf(channels),
              "-y",
              raw.path().toString());

      ProcessRunner.Result result = processRunner.run(command, "ffmpeg decode", timeout());
      if (!result.isSuccess()) {
        throw new ExternalServiceException(
            "ffmpeg decode failed: " + result.outputSnippet(300));
      }

      AudioClip clip = AudioClip.fromPcm16Le(Files.readAllBytes(raw.path()), sampleRate, channels);
      LOGGER.debug("Decoded {} into {}", audioFile.getFileName(), clip);
      return clip;

    } catch (IOException | TimeoutException e) {
      throw new ExternalServiceException("Failed to decode audio: " + audioFile.getFileName(), e);
    }
  }

  /**
   * Encode a clip as MP3.
   *
   * @throws ExternalServiceException if ffmpeg fails
   */
  public byte[] encodeMp3(AudioClip clip) {
    try (ScopedTempFile wav = ScopedTempFile.create(tempDir, "encode_", ".wav");
        ScopedTempFile mp3 = ScopedTempFile.create(tempDir, "encode_", ".mp3")) {
      Files.write(wav.path(), wavEncoder.encode(clip));

      List<String> command =
          List.of(
              properties.ffmpegPath(),
              "-v", "error",
              "-i", wav.path().toString(),
              "-codec:a", "libmp3lame",
              "-q:a", String.valueOf(properties.mp3Quality()),
              "-y",
              mp3.path().toString());

      ProcessRunner.Result result = processRunner.run(command, "ffmpeg mp3 encode", timeout());
      if (!result.isSuccess()) {
        throw new ExternalServiceException(
            "ffmpeg mp3 encode failed: " + result.outputSnippet(300));
      }

      byte[] encoded = Files.readAllBytes(mp3.path());
      LOGGER.debug("Encoded {} as {} bytes of MP3", clip, encoded.length);
      return encoded;

    } catch (IOException | TimeoutException e) {
      throw new ExternalServiceException("Failed to encode MP3", e);
    }
  }

  private Duration timeout() {
    return Duration.ofSeconds(properties.timeoutSeconds());
  }
}
