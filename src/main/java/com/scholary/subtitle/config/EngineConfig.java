package com.scholary.subtitle.config;

import com.scholary.subtitle.media.FfmpegProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the pipelines and the ffmpeg tooling they call.
 *
 * <p>Enables EngineProperties and FfmpegProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties({EngineProperties.class, FfmpegProperties.class})
public class EngineConfig {}
