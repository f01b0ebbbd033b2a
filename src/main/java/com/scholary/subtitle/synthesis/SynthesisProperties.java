package com.scholary.subtitle.synthesis;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech synthesis backends.
 *
 * <p>{@code googleTtsMaxChars} is the longest text the Google endpoint accepts per request;
 * longer segments are split on word boundaries.
 */
@ConfigurationProperties(prefix = "synthesis")
@Validated
public record SynthesisProperties(
    @NotBlank String googleTtsUrl,
    @Positive @Max(200) int googleTtsMaxChars,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @NotBlank String edgeTtsPath,
    @NotBlank String espeakPath,
    @Positive int processTimeoutSeconds) {}
