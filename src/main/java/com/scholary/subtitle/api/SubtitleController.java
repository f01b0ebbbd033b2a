package com.scholary.subtitle.api;

import com.scholary.subtitle.job.JobService;
import com.scholary.subtitle.job.PipelineJob;
import com.scholary.subtitle.pipeline.TranscriptionResult;
import com.scholary.subtitle.subtitle.Segment;
import com.scholary.subtitle.subtitle.SubtitleParser;
import com.scholary.subtitle.subtitle.SubtitleSerializer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for subtitles.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous subtitle generation from a media file (returns job ID immediately)
 *   <li>Parsing subtitle text into segments, for editing
 *   <li>Rendering edited segments back into subtitle text
 * </ul>
 */
@RestController
@Tag(name = "Subtitles", description = "Subtitle generation, parsing and rendering")
public class SubtitleController {

  private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleController.class);

  private final JobService jobService;
  private final SubtitleParser parser;
  private final SubtitleSerializer serializer;

  public SubtitleController(
      JobService jobService, SubtitleParser parser, SubtitleSerializer serializer) {
    this.jobService = jobService;
    this.parser = parser;
    this.serializer = serializer;
  }

  @PostMapping("/api/subtitles")
  @Operation(
      summary = "Generate subtitles",
      description =
          "Extract, transcribe and translate a media file into a subtitle file. Returns a job ID"
              + " for status polling.")
  public ResponseEntity<AsyncJobResponse> generate(@Valid @RequestBody SubtitleJobRequest request) {
    LOGGER.info(
        "Subtitle request: media={}, destination={}, language={}",
        request.mediaPath(),
        request.subtitlePath(),
        request.targetLanguage());

    PipelineJob<TranscriptionResult> job =
        jobService.submitTranscription(
            request.mediaPath(), request.subtitlePath(), request.targetLanguage());

    return ResponseEntity.accepted().body(new AsyncJobResponse(job.getJobId()));
  }

  @PostMapping(value = "/api/subtitles/parse", consumes = MediaType.TEXT_PLAIN_VALUE)
  @Operation(
      summary = "Parse subtitle text",
      description = "Parse subtitle text into segments. Malformed blocks are skipped.")
  public List<Segment> parse(@RequestBody(required = false) String subtitleText) {
    return parser.parse(subtitleText == null ? "" : subtitleText);
  }

  @PostMapping(value = "/api/subtitles/render", produces = MediaType.TEXT_PLAIN_VALUE)
  @Operation(
      summary = "Render subtitle text",
      description = "Serialize segments into subtitle text, numbering blocks from 1.")
  public String render(@RequestBody List<Segment> segments) {
    return serializer.serialize(segments);
  }
}
