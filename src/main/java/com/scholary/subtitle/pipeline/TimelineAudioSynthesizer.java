package com.scholary.subtitle.pipeline;

import com.scholary.subtitle.audio.AudioClip;
import com.scholary.subtitle.audio.Timeline;
import com.scholary.subtitle.audio.TimelineTooLongException;
import com.scholary.subtitle.exception.SubtitleEngineException;
import com.scholary.subtitle.logging.StructuredLogger;
import com.scholary.subtitle.subtitle.Segment;
import com.scholary.subtitle.subtitle.TimestampCodec;
import com.scholary.subtitle.synthesis.SpeechSynthesizer;
import com.scholary.subtitle.synthesis.SynthesisException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one voice track from timed segments.
 *
 * <p>Segments are processed in list order. Before each segment, silence fills the gap between the
 * cursor (the declared end of the previous segment) and the segment's start. The synthesized clip
 * is appended as-is, however long it is, and the cursor then jumps to the segment's declared end.
 * When clips run longer than their slots, or segments overlap, the track drifts later than the
 * subtitle times; nothing trims or stretches to correct it.
 *
 * <p>A segment whose synthesis fails is skipped with a progress warning. Its slot still moves the
 * cursor, so the next gap is measured from the failed segment's end. An interrupt of the worker
 * thread is not a per-segment failure: it ends the run.
 */
public class TimelineAudioSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimelineAudioSynthesizer.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  /** The assembled track and how many segments made it in. */
  public record Result(AudioClip audio, int synthesized, int skipped) {}

  private final SpeechSynthesizer synthesizer;
  private final int sampleRate;
  private final int channels;
  private final int maxTrackSeconds;

  public TimelineAudioSynthesizer(
      SpeechSynthesizer synthesizer, int sampleRate, int channels, int maxTrackSeconds) {
    this.synthesizer = synthesizer;
    this.sampleRate = sampleRate;
    this.channels = channels;
    this.maxTrackSeconds = maxTrackSeconds;
  }

  /**
   * Synthesize and assemble all segments.
   *
   * @param segments the segments, in playback order
   * @param language target language code passed to the backend
   * @param context progress channel and cancellation flag
   * @return the assembled track, empty for an empty segment list
   * @throws TaskCancelledException if the task is cancelled between two segments
   * @throws SubtitleEngineException if the worker thread is interrupted
   * @throws TimelineTooLongException if a segment would push the track past its maximum length
   */
  public Result synthesize(List<Segment> segments, String language, TaskContext context) {
    Timeline timeline = new Timeline(sampleRate, channels, maxTrackSeconds);
    int synthesized = 0;
    int skipped = 0;

    for (Segment segment : segments) {
      context.checkCancelled();
      checkInterrupted("before segment " + segment.index());

      double gap = segment.start() - timeline.cursor();
      if (gap > 0) {
        try {
          timeline.appendSilence(gap);
        } catch (TimelineTooLongException e) {
          throw tooLong(segment, e);
        }
      }

      String failure = null;
      AudioClip clip = null;
      try {
        clip = synthesizer.synthesize(segment.text(), language);
        if (clip == null || clip.isEmpty()) {
          failure = "backend returned no audio";
        }
      } catch (SynthesisException e) {
        failure = e.getMessage();
      }

      if (failure == null) {
        try {
          timeline.append(clip);
        } catch (TimelineTooLongException e) {
          throw tooLong(segment, e);
        }
        synthesized++;
        STRUCTURED.logSegmentSynthesized(
            segment.index(),
            segment.start(),
            segment.end(),
            Math.max(gap, 0),
            clip.durationSeconds());
      } else {
        skipped++;
        STRUCTURED.logSynthesisSkipped(
            segment.index(), segment.start(), segment.end(), "SynthesisException", failure);
        context.progress(
            "Skipping segment " + segment.index() + " due to synthesis error: " + failure);
      }

      timeline.moveCursor(segment.end());
    }
    if (!segments.isEmpty()) {
      checkInterrupted("after segment " + segments.get(segments.size() - 1).index());
    }

    LOGGER.info(
        "Timeline assembled: segments={}, synthesized={}, skipped={}, duration={}s",
        segments.size(),
        synthesized,
        skipped,
        timeline.durationSeconds());
    return new Result(timeline.toClip(), synthesized, skipped);
  }

  // backends fail fast once the interrupt flag is set, so this must end the run
  private static void checkInterrupted(String where) {
    if (Thread.currentThread().isInterrupted()) {
      throw new SubtitleEngineException("Voice synthesis interrupted " + where);
    }
  }

  private static TimelineTooLongException tooLong(Segment segment, TimelineTooLongException e) {
    return new TimelineTooLongException(
        "Segment "
            + segment.index()
            + " starting at "
            + TimestampCodec.encode(segment.start())
            + ": "
            + e.getMessage(),
        e);
  }
}
