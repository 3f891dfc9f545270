package com.scholary.audio.segmenter.topics;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the topic segmentation client.
 *
 * <p>{@code baseUrl} points at an OpenAI-compatible chat completions API. {@code context} is a
 * short description of the recordings that is passed to the model with every transcript.
 */
@ConfigurationProperties(prefix = "segmentation")
@Validated
public record SegmentationProperties(
    @NotBlank String baseUrl,
    @NotBlank String model,
    @NotBlank String apiKeySecret,
    @DecimalMin("0.0") @DecimalMax("2.0") double temperature,
    String context,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
