package com.scholary.subtitle.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the pipelines.
 *
 * <p>{@code sampleRate} and {@code channels} fix the format of the assembled voice timeline;
 * every synthesized clip is decoded to it. {@code maxTrackSeconds} caps the timeline's length. The
 * executor settings bound how many pipelines run at once.
 */
@ConfigurationProperties(prefix = "engine")
@Validated
public record EngineProperties(
    @NotBlank String tempDir,
    @Positive int sampleRate,
    @Positive @Max(2) int channels,
    @Positive int maxTrackSeconds,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {}
