package com.scholary.subtitle.synthesis;

import com.scholary.subtitle.audio.AudioDecoder;
import com.scholary.subtitle.config.EngineProperties;
import com.scholary.subtitle.media.ProcessRunner;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates the synthesis backend for a voice selector.
 *
 * <p>Every call returns a new instance, so two voice pipelines never share a backend or its HTTP
 * client. The backend decodes into the engine's timeline format.
 */
@Component
public class SpeechSynthesizerFactory {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpeechSynthesizerFactory.class);

  private final SynthesisProperties properties;
  private final ProcessRunner processRunner;
  private final AudioDecoder decoder;
  private final Path tempDir;
  private final int sampleRate;
  private final int channels;

  public SpeechSynthesizerFactory(
      SynthesisProperties properties,
      ProcessRunner processRunner,
      AudioDecoder decoder,
      EngineProperties engineProperties) {
    this.properties = properties;
    this.processRunner = processRunner;
    this.decoder = decoder;
    this.tempDir = Paths.get(engineProperties.tempDir());
    this.sampleRate = engineProperties.sampleRate();
    this.channels = engineProperties.channels();
  }

  public SpeechSynthesizer create(VoiceSelector voice) {
    SpeechSynthesizer synthesizer;
    switch (voice.backend()) {
      case GOOGLE_TTS:
        synthesizer = new GoogleTtsSynthesizer(properties, decoder, tempDir, sampleRate, channels);
        break;
      case EDGE_TTS:
        synthesizer =
            new EdgeTtsSynthesizer(
                properties, processRunner, voice.voiceName(), decoder, tempDir, sampleRate,
                channels);
        break;
      case ESPEAK:
        synthesizer =
            new EspeakSynthesizer(properties, processRunner, decoder, tempDir, sampleRate, channels);
        break;
      default:
        throw new IllegalArgumentException("Unsupported voice: " + voice);
    }
    LOGGER.debug("Created synthesizer for {}: {}", voice, synthesizer.describe());
    return synthesizer;
  }
}
