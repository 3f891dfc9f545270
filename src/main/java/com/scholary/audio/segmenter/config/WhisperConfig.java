package com.scholary.audio.segmenter.config;

import com.scholary.audio.segmenter.whisper.WhisperProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the WhisperProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(WhisperProperties.class)
public class WhisperConfig {}
