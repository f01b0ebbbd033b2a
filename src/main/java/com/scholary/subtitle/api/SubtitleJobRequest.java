package com.scholary.subtitle.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Request for generating a translated subtitle file from a media file.
 *
 * <p>Paths may be local paths or {@code s3://bucket/key} locations. The job runs asynchronously;
 * poll /api/jobs/{id} for status and progress.
 */
public record SubtitleJobRequest(
    @NotBlank String mediaPath, @NotBlank String subtitlePath, @NotBlank String targetLanguage) {}
