package com.scholary.subtitle.synthesis;

import com.scholary.subtitle.audio.AudioClip;
import com.scholary.subtitle.audio.AudioDecoder;
import com.scholary.subtitle.exception.ExternalServiceException;
import com.scholary.subtitle.storage.ScopedTempFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for backends that produce an audio file.
 *
 * <p>Each call renders into its own temporary file, decodes it to the timeline format and deletes
 * the file, whether rendering succeeded or not.
 */
public abstract class FileBackedSynthesizer implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileBackedSynthesizer.class);

  private final AudioDecoder decoder;
  private final Path tempDir;
  private final int sampleRate;
  private final int channels;

  protected FileBackedSynthesizer(
      AudioDecoder decoder, Path tempDir, int sampleRate, int channels) {
    this.decoder = decoder;
    this.tempDir = tempDir;
    this.sampleRate = sampleRate;
    this.channels = channels;
  }

  @Override
  public final AudioClip synthesize(String text, String language) throws SynthesisException {
    if (text == null || text.isBlank()) {
      throw new SynthesisException("No text to speak");
    }

    try (ScopedTempFile output = ScopedTempFile.create(tempDir, "tts_", fileSuffix())) {
      render(text, language, output.path());

      if (Files.size(output.path()) == 0) {
        throw new SynthesisException(describe() + " produced an empty file");
      }
      AudioClip clip = decoder.decode(output.path(), sampleRate, channels);
      LOGGER.debug("{} synthesized {} chars into {}", describe(), text.length(), clip);
      return clip;

    } catch (IOException e) {
      throw new SynthesisException(describe() + " failed: " + e.getMessage(), e);
    } catch (ExternalServiceException e) {
      throw new SynthesisException(describe() + " output could not be decoded", e);
    }
  }

  /** Suffix of the file {@link #render} writes, e.g. ".mp3". */
  protected abstract String fileSuffix();

  /**
   * Write synthesized speech for {@code text} to {@code output}.
   *
   * @throws SynthesisException if the backend rejects the request
   * @throws IOException on I/O failure talking to the backend
   */
  protected abstract void render(String text, String language, Path output)
      throws SynthesisException, IOException;
}
