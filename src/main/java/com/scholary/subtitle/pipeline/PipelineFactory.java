package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.audio.AudioEncoder;
import com.scholary.subtitle.config.EngineProperties;
import com.scholary.subtitle.media.AudioExtractor;
import com.scholary.subtitle.storage.OutputStore;
import com.scholary.subtitle.stt.SpeechToTextClient;
import com.scholary.subtitle.subtitle.SubtitleParser;
import com.scholary.subtitle.subtitle.SubtitleSerializer;
import com.scholary.subtitle.synthesis.SpeechSynthesizer;
import com.scholary.subtitle.synthesis.SpeechSynthesizerFactory;
import com.scholary.subtitle.synthesis.VoiceSelector;
import com.scholary.subtitle.translation.TranslationClientFactory;
import org.springframework.stereotype.Component;

/**
 * Wires a fresh pipeline for each run.
 *
 * <p>Stateless collaborators are shared. The translation client and the synthesis backend are
 * created here per pipeline.
 */
@Component
public class PipelineFactory {

  private final AudioExtractor extractor;
  private final SpeechToTextClient speechToText;
  private final TranslationClientFactory translationClientFactory;
  private final SpeechSynthesizerFactory synthesizerFactory;
  private final SubtitleSerializer serializer;
  private final SubtitleParser parser;
  private final AudioEncoder encoder;
  private final OutputStore outputStore;
  private final EngineProperties engineProperties;

  public PipelineFactory(
      AudioExtractor extractor,
      SpeechToTextClient speechToText,
      TranslationClientFactory translationClientFactory,
      SpeechSynthesizerFactory synthesizerFactory,
      SubtitleSerializer serializer,
      SubtitleParser parser,
      AudioEncoder encoder,
      OutputStore outputStore,
      EngineProperties engineProperties) {
    this.extractor = extractor;
    this.speechToText = speechToText;
    this.translationClientFactory = translationClientFactory;
    this.synthesizerFactory = synthesizerFactory;
    this.serializer = serializer;
    this.parser = parser;
    this.encoder = encoder;
    this.outputStore = outputStore;
    this.engineProperties = engineProperties;
  }

  public TranscriptionPipeline transcription(
      String mediaLocation, String subtitleDestination, String targetLanguage) {
    return new TranscriptionPipeline(
        extractor,
        speechToText,
        translationClientFactory.create(),
        serializer,
        outputStore,
        mediaLocation,
        subtitleDestination,
        targetLanguage);
  }

  public VoiceGenerationPipeline voice(
      SubtitleSource source, String audioDestination, String targetLanguage, VoiceSelector voice) {
    SpeechSynthesizer backend = synthesizerFactory.create(voice);
    TimelineAudioSynthesizer synthesizer =
        new TimelineAudioSynthesizer(
            backend,
            engineProperties.sampleRate(),
            engineProperties.channels(),
            engineProperties.maxTrackSeconds());
    return new VoiceGenerationPipeline(
        parser, synthesizer, encoder, outputStore, source, audioDestination, targetLanguage);
  }
}
