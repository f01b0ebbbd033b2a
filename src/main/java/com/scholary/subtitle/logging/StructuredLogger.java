package com.scholary.subtitle.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts its event fields into the MDC for the duration of one log call, so they can
 * be queried in a log index alongside the job context set by the task runner.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log a pipeline state transition. */
  public void logStateChange(String pipeline, Object from, Object to) {
    try {
      MDC.put("event_type", "pipeline_state");
      MDC.put("state", String.valueOf(to));

      logger.info("Pipeline state: pipeline={}, {} -> {}", pipeline, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log one translated segment. */
  public void logSegmentTranslated(int segmentIndex, boolean translated) {
    try {
      MDC.put("event_type", "segment_translated");
      MDC.put("segment_index", String.valueOf(segmentIndex));

      logger.debug("Segment translated: index={}, translated={}", segmentIndex, translated);
    } finally {
      clearEventFields();
    }
  }

  /** Log a translation failure that fell back to the source text. */
  public void logTranslationFallback(int segmentIndex, String message) {
    try {
      MDC.put("event_type", "translation_fallback");
      MDC.put("segment_index", String.valueOf(segmentIndex));

      logger.warn("Translation fallback: index={}, message={}", segmentIndex, message);
    } finally {
      clearEventFields();
    }
  }

  /** Log one segment placed on the voice timeline. */
  public void logSegmentSynthesized(
      int segmentIndex, double start, double end, double gapSeconds, double clipSeconds) {
    try {
      MDC.put("event_type", "segment_synthesized");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("gapSeconds", String.valueOf(gapSeconds));
      MDC.put("clipSeconds", String.valueOf(clipSeconds));

      logger.debug(
          "Segment synthesized: index={}, slot=[{}-{}], gap={}s, clip={}s",
          segmentIndex,
          start,
          end,
          gapSeconds,
          clipSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log a segment left out of the voice timeline. */
  public void logSynthesisSkipped(
      int segmentIndex, double start, double end, String errorType, String message) {
    try {
      MDC.put("event_type", "synthesis_skipped");
      MDC.put("segment_index", String.valueOf(segmentIndex));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("errorType", errorType);

      logger.warn(
          "Synthesis skipped: index={}, slot=[{}-{}], error={}, message={}",
          segmentIndex,
          start,
          end,
          errorType,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String pipeline) {
    MDC.put("jobId", jobId);
    MDC.put("pipeline", pipeline);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("pipeline");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("segment_index");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("gapSeconds");
    MDC.remove("clipSeconds");
    MDC.remove("state");
    MDC.remove("errorType");
  }
}
