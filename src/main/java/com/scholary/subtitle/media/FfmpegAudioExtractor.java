package com.scholary.subtitle.media;

import com.scholary.subtitle.config.EngineProperties;
import com.scholary.subtitle.exception.ExternalServiceException;
import com.scholary.subtitle.storage.ScopedTempFile;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Extracts a mono 16-bit WAV track with ffmpeg and probes the media duration with ffprobe.
 *
 * <p>The WAV file is created as a {@link ScopedTempFile} and handed to the caller inside an
 * {@link ExtractedAudio}. If anything fails before that hand-off, the file is deleted here.
 */
@Component
public class FfmpegAudioExtractor implements AudioExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioExtractor.class);

  private final FfmpegProperties properties;
  private final ProcessRunner processRunner;
  private final Path tempDir;

  public FfmpegAudioExtractor(
      FfmpegProperties properties, ProcessRunner processRunner, EngineProperties engineProperties) {
    this.properties = properties;
    this.processRunner = processRunner;
    this.tempDir = Paths.get(engineProperties.tempDir());
  }

  @Override
  public ExtractedAudio extract(String mediaLocation) {
    LOGGER.info("Extracting audio: media={}", mediaLocation);

    ScopedTempFile wav = null;
    try {
      wav = ScopedTempFile.create(tempDir, "extract_", ".wav");

      List<String> command =
          List.of(
              properties.ffmpegPath(),
              "-v", "error",
              "-i", mediaLocation,
              "-vn",
              "-acodec", "pcm_s16le",
              "-ac", "1",
              "-ar", String.valueOf(properties.extractSampleRate()),
              "-y",
              wav.path().toString());

      ProcessRunner.Result result = processRunner.run(command, "ffmpeg extract", timeout());
      if (!result.isSuccess()) {
        throw new ExternalServiceException(
            "Audio extraction failed for " + mediaLocation + ": " + result.outputSnippet(300));
      }

      double duration = probeDuration(mediaLocation);
      LOGGER.info("Audio extracted: media={}, duration={}s", mediaLocation, duration);

      ExtractedAudio extracted = new ExtractedAudio(wav, duration);
      wav = null;
      return extracted;

    } catch (IOException | TimeoutException e) {
      throw new ExternalServiceException(
          "Audio extraction failed for " + mediaLocation + ": " + e.getMessage(), e);
    } finally {
      if (wav != null) {
        wav.close();
      }
    }
  }

  /** Media duration in seconds, as reported by ffprobe. */
  double probeDuration(String mediaLocation) throws IOException, TimeoutException {
    LOGGER.debug("Getting duration with ffprobe: media={}", mediaLocation);

    List<String> command =
        List.of(
            properties.ffprobePath(),
            "-v", "error",
            "-show_entries", "format=duration",
            "-of", "default=noprint_wrappers=1:nokey=1",
            mediaLocation);

    ProcessRunner.Result result = processRunner.run(command, "ffprobe", timeout());
    if (!result.isSuccess()) {
      throw new ExternalServiceException(
          "ffprobe failed for " + mediaLocation + ": " + result.outputSnippet(300));
    }

    try {
      return Double.parseDouble(result.output().trim());
    } catch (NumberFormatException e) {
      throw new ExternalServiceException(
          "Failed to parse duration from ffprobe output: " + result.outputSnippet(100), e);
    }
  }

  private Duration timeout() {
    return Duration.ofSeconds(properties.timeoutSeconds());
  }
}
