package com.scholary.audio.segmenter.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the speech-to-text client.
 *
 * <p>{@code language} is fixed for every request; the service does no language detection. The API
 * key is not configured directly; {@code apiKeySecret} names the secret it is read
 * from.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @NotBlank String model,
    @NotBlank String language,
    @NotBlank String apiKeySecret,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}
