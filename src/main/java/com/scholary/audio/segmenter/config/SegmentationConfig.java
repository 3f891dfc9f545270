package com.scholary.audio.segmenter.config;

import com.scholary.audio.segmenter.topics.SegmentationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the SegmentationProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(SegmentationProperties.class)
public class SegmentationConfig {}
