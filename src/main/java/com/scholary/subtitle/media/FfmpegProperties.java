package com.scholary.subtitle.media;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * <p>Extraction produces mono audio at {@code extractSampleRate}, the rate speech-to-text models
 * expect. {@code mp3Quality} is the LAME VBR level (0 best, 9 smallest).
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String ffmpegPath,
    @NotBlank String ffprobePath,
    @Positive int timeoutSeconds,
    @Positive int extractSampleRate,
    @Min(0) @Max(9) int mp3Quality) {}
