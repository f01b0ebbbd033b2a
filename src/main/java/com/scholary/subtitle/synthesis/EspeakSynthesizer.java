package com.scholary.subtitle.synthesis;

import com.scholary.subtitle.audio.AudioDecoder;
import com.scholary.subtitle.media.ProcessRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Offline speech through the system's {@code espeak-ng} voice.
 *
 * <p>Uses the default system voice whatever the target language, like a desktop TTS engine
 * would.
 */
public class EspeakSynthesizer extends FileBackedSynthesizer {

  private final SynthesisProperties properties;
  private final ProcessRunner processRunner;

  public EspeakSynthesizer(
      SynthesisProperties properties,
      ProcessRunner processRunner,
      AudioDecoder decoder,
      Path tempDir,
      int sampleRate,
      int channels) {
    super(decoder, tempDir, sampleRate, channels);
    this.properties = properties;
    this.processRunner = processRunner;
  }

  @Override
  public String describe() {
    return "System voice (espeak-ng)";
  }

  @Override
  protected String fileSuffix() {
    return ".wav";
  }

  @Override
  protected void render(String text, String language, Path output)
      throws SynthesisException, IOException {
    List<String> command = List.of(properties.espeakPath(), "-w", output.toString(), "--", text);

    try {
      ProcessRunner.Result result =
          processRunner.run(
              command, "espeak-ng", Duration.ofSeconds(properties.processTimeoutSeconds()));
      if (!result.isSuccess()) {
        throw new SynthesisException("espeak-ng failed: " + result.outputSnippet(200));
      }
    } catch (TimeoutException e) {
      throw new SynthesisException("espeak-ng timed out", e);
    }
  }
}
