package com.scholary.subtitle.api;

import com.scholary.subtitle.job.JobService;
import com.scholary.subtitle.job.PipelineJob;
import com.scholary.subtitle.pipeline.SubtitleSource;
import com.scholary.subtitle.pipeline.SynthesisReport;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/** REST API for timeline-aligned voice generation. */
@RestController
@Tag(name = "Voice", description = "Voice track generation from subtitles")
public class VoiceController {

  private static final Logger LOGGER = LoggerFactory.getLogger(VoiceController.class);

  private final JobService jobService;

  public VoiceController(JobService jobService) {
    this.jobService = jobService;
  }

  @PostMapping("/api/voice")
  @Operation(
      summary = "Generate voice track",
      description =
          "Synthesize each subtitle segment and place it on a timeline matching the subtitle"
              + " times. Returns a job ID for status polling.")
  public ResponseEntity<AsyncJobResponse> generate(@Valid @RequestBody VoiceJobRequest request) {
    boolean hasText = request.subtitleText() != null;
    boolean hasPath = request.subtitlePath() != null && !request.subtitlePath().isBlank();
    if (hasText == hasPath) {
      throw new IllegalArgumentException("Provide exactly one of subtitleText or subtitlePath");
    }

    SubtitleSource source =
        hasPath
            ? SubtitleSource.stored(request.subtitlePath())
            : SubtitleSource.inline(request.subtitleText());

    LOGGER.info(
        "Voice request: source={}, destination={}, language={}, voice={}",
        source.describe(),
        request.audioPath(),
        request.targetLanguage(),
        request.voice());

    PipelineJob<SynthesisReport> job =
        jobService.submitVoice(
            source, request.audioPath(), request.targetLanguage(), request.voice());

    return ResponseEntity.accepted().body(new AsyncJobResponse(job.getJobId()));
  }
}
