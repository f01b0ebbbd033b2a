package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.audio.AudioEncoder;
import com.scholary.subtitle.audio.ContainerFormat;
import com.scholary.subtitle.storage.OutputStore;
import com.scholary.subtitle.subtitle.Segment;
import com.scholary.subtitle.subtitle.SubtitleParser;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns subtitle text into a single voice track aligned to the subtitle times.
 *
 * <p>Subtitles given by location are read inside the run, so an unreadable source fails the task
 * like any other stage. Subtitle text with no usable blocks is not an error: the run succeeds with an empty report
 * and writes nothing.
 */
public class VoiceGenerationPipeline implements TaskBody<SynthesisReport> {

  public static final String NAME = "voice";

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceGenerationPipeline.class);

  private final SubtitleParser parser;
  private final TimelineAudioSynthesizer synthesizer;
  private final AudioEncoder encoder;
  private final OutputStore outputStore;

  private final SubtitleSource source;
  private final String destination;
  private final String targetLanguage;

  public VoiceGenerationPipeline(
      SubtitleParser parser,
      TimelineAudioSynthesizer synthesizer,
      AudioEncoder encoder,
      OutputStore outputStore,
      SubtitleSource source,
      String destination,
      String targetLanguage) {
    this.parser = parser;
    this.synthesizer = synthesizer;
    this.encoder = encoder;
    this.outputStore = outputStore;
    this.source = source;
    this.destination = destination;
    this.targetLanguage = targetLanguage;
  }

  @Override
  public SynthesisReport run(TaskContext context) {
    context.progress("Generating voice audio based on timeline...");

    if (source.isStored()) {
      context.progress("Reading subtitles from " + source.location());
    }
    List<Segment> segments = parser.parse(source.load(outputStore));
    if (segments.isEmpty()) {
      context.progress("No valid subtitle segments found.");
      return SynthesisReport.empty();
    }

    TimelineAudioSynthesizer.Result assembled =
        synthesizer.synthesize(segments, targetLanguage, context);

    ContainerFormat format = ContainerFormat.forDestination(destination);
    if (!ContainerFormat.isSupported(destination)) {
      LOGGER.warn(
          "Unsupported audio extension for {}, writing {} instead", destination, format);
    }

    context.checkCancelled();
    byte[] encoded = encoder.encode(assembled.audio(), format);
    outputStore.write(destination, encoded, format.contentType());
    context.progress("Voice audio saved to " + destination);

    return new SynthesisReport(
        destination,
        format,
        segments.size(),
        assembled.synthesized(),
        assembled.skipped(),
        assembled.audio().durationSeconds());
  }
}
