package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.logging.StructuredLogger;
import com.scholary.subtitle.media.AudioExtractor;
import com.scholary.subtitle.media.ExtractedAudio;
import com.scholary.subtitle.storage.OutputStore;
import com.scholary.subtitle.stt.SpeechToTextClient;
import com.scholary.subtitle.stt.Transcript;
import com.scholary.subtitle.stt.TranscriptSegment;
import com.scholary.subtitle.subtitle.Segment;
import com.scholary.subtitle.subtitle.SubtitleSerializer;
import com.scholary.subtitle.translation.SegmentTranslator;
import com.scholary.subtitle.translation.TranslationClient;
import com.scholary.subtitle.translation.TranslationOutcome;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a media file into a translated subtitle file.
 *
 * <p>Flow: extract audio, transcribe, translate each segment in order, serialize, write. A
 * translation failure keeps the segment's source text and reports a warning; every other failure
 * ends the run. The destination is only written once the whole subtitle text exists.
 *
 * <p>One instance handles one run.
 */
public class TranscriptionPipeline implements TaskBody<TranscriptionResult> {

  public static final String NAME = "transcription";
  public static final String SUBTITLE_CONTENT_TYPE = "application/x-subrip";

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionPipeline.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private final AudioExtractor extractor;
  private final SpeechToTextClient speechToText;
  private final SegmentTranslator translator;
  private final SubtitleSerializer serializer;
  private final OutputStore outputStore;

  private final String mediaLocation;
  private final String destination;
  private final String targetLanguage;

  private volatile PipelineState state = PipelineState.IDLE;

  public TranscriptionPipeline(
      AudioExtractor extractor,
      SpeechToTextClient speechToText,
      TranslationClient translationClient,
      SubtitleSerializer serializer,
      OutputStore outputStore,
      String mediaLocation,
      String destination,
      String targetLanguage) {
    this.extractor = extractor;
    this.speechToText = speechToText;
    this.translator = new SegmentTranslator(translationClient);
    this.serializer = serializer;
    this.outputStore = outputStore;
    this.mediaLocation = mediaLocation;
    this.destination = destination;
    this.targetLanguage = targetLanguage;
  }

  public PipelineState state() {
    return state;
  }

  @Override
  public TranscriptionResult run(TaskContext context) {
    if (state != PipelineState.IDLE) {
      throw new IllegalStateException("Pipeline already ran, state=" + state);
    }
    try {
      List<Segment> segments = transcribe(context);

      transition(PipelineState.TRANSLATING);
      context.progress("Translating segments...");
      List<Segment> translated = new ArrayList<>(segments.size());
      int fallbackCount = 0;
      for (Segment segment : segments) {
        context.checkCancelled();
        TranslationOutcome outcome = translator.translate(segment.text(), targetLanguage);
        if (outcome.hasWarning()) {
          fallbackCount++;
          STRUCTURED.logTranslationFallback(segment.index(), outcome.warning());
          context.progress(
              "Warning: Translation error for segment "
                  + segment.index()
                  + ": "
                  + outcome.warning());
        } else {
          STRUCTURED.logSegmentTranslated(segment.index(), outcome.translated());
        }
        translated.add(segment.withText(outcome.text()));
      }

      context.checkCancelled();
      transition(PipelineState.SERIALIZING);
      String subtitleText = serializer.serialize(translated);
      outputStore.write(
          destination, subtitleText.getBytes(StandardCharsets.UTF_8), SUBTITLE_CONTENT_TYPE);
      context.progress("Subtitle file saved to " + destination);

      transition(PipelineState.DONE);
      return new TranscriptionResult(subtitleText, destination, translated, fallbackCount);

    } catch (RuntimeException e) {
      transition(PipelineState.FAILED);
      throw e;
    }
  }

  private List<Segment> transcribe(TaskContext context) {
    transition(PipelineState.EXTRACTING);
    context.progress("Extracting audio from media...");

    try (ExtractedAudio audio = extractor.extract(mediaLocation)) {
      context.progress(
          "Audio extracted. Speech-to-text backend ready (" + speechToText.describe() + ").");
      context.checkCancelled();

      transition(PipelineState.TRANSCRIBING);
      context.progress("Transcribing audio...");
      Transcript transcript = speechToText.transcribe(audio.path());

      List<Segment> segments = toSegments(transcript, audio.durationSeconds());
      context.progress("Transcribed " + segments.size() + " segments.");
      return segments;
    }
  }

  /** Timed segments from the transcript, or one segment spanning the media if it has none. */
  static List<Segment> toSegments(Transcript transcript, double mediaDuration) {
    List<TranscriptSegment> timed = transcript.segments();
    if (timed.isEmpty()) {
      LOGGER.info("No timed segments, using the full transcript as one segment");
      return List.of(new Segment(1, 0.0, mediaDuration, transcript.text()));
    }

    List<Segment> segments = new ArrayList<>(timed.size());
    for (TranscriptSegment ts : timed) {
      String text = ts.text() == null ? "" : ts.text();
      segments.add(new Segment(segments.size() + 1, ts.start(), ts.end(), text));
    }
    return segments;
  }

  private void transition(PipelineState next) {
    PipelineState previous = state;
    state = next;
    STRUCTURED.logStateChange(NAME, previous, next);
  }
}
