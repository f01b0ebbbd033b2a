package com.scholary.subtitle.config;

import com.scholary.subtitle.synthesis.SynthesisProperties;
import com.scholary.subtitle.translation.TranslationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the translation and speech synthesis properties. */
@Configuration
@EnableConfigurationProperties({TranslationProperties.class, SynthesisProperties.class})
public class TranslationConfig {}
