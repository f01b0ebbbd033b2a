package com.scholary.subtitle.synthesis;

import com.scholary.subtitle.audio.AudioDecoder;
import com.scholary.subtitle.media.ProcessRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Neural voices from Microsoft Edge's read-aloud service, through the {@code edge-tts} tool.
 *
 * <p>The voice already fixes the language, so the language argument is not passed on.
 */
public class EdgeTtsSynthesizer extends FileBackedSynthesizer {

  private final SynthesisProperties properties;
  private final ProcessRunner processRunner;
  private final String voiceName;

  public EdgeTtsSynthesizer(
      SynthesisProperties properties,
      ProcessRunner processRunner,
      String voiceName,
      AudioDecoder decoder,
      Path tempDir,
      int sampleRate,
      int channels) {
    super(decoder, tempDir, sampleRate, channels);
    this.properties = properties;
    this.processRunner = processRunner;
    this.voiceName = voiceName;
  }

  @Override
  public String describe() {
    return "Edge TTS (" + voiceName + ")";
  }

  @Override
  protected String fileSuffix() {
    return ".mp3";
  }

  @Override
  protected void render(String text, String language, Path output)
      throws SynthesisException, IOException {
    List<String> command =
        List.of(
            properties.edgeTtsPath(),
            "--voice", voiceName,
            "--rate=+0%",
            "--text", text,
            "--write-media", output.toString());

    try {
      ProcessRunner.Result result =
          processRunner.run(
              command, "edge-tts", Duration.ofSeconds(properties.processTimeoutSeconds()));
      if (!result.isSuccess()) {
        throw new SynthesisException("edge-tts failed: " + result.outputSnippet(200));
      }
    } catch (TimeoutException e) {
      throw new SynthesisException("edge-tts timed out", e);
    }
  }
}
