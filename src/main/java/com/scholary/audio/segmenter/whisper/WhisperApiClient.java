package com.scholary.audio.segmenter.whisper;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audio.segmenter.secrets.SecretSource;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for the OpenAI-compatible audio transcription endpoint.
 *
 * <p>Each call posts one chunk as multipart/form-data to {@code /v1/audio/transcriptions}, asking
 * for {@code verbose_json} with segment-level timestamps in the configured language.
 *
 * <p>This client never retries. A non-200 response becomes a {@link WhisperException} carrying the
 * status code and, for rate limiting, the {@code x-ratelimit-reset-requests} hint. Transport and
 * parse failures carry no status. The caller decides what is worth another attempt.
 *
 * <p>The API key is looked up through {@link SecretSource}, which caches it for the process. A run
 * resolves it up front through {@link #resolveCredentials()}, so a missing key fails the run before
 * any audio is sent.
 */
@Component
public class WhisperApiClient implements TranscriptionClient {

  static final String RATE_LIMIT_RESET_HEADER = "x-ratelimit-reset-requests";

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperApiClient.class);
  private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|h|m|s)");

  private final HttpClient httpClient;
  private final WhisperProperties properties;
  private final ObjectMapper objectMapper;
  private final SecretSource secretSource;

  public WhisperApiClient(
      WhisperProperties properties, ObjectMapper objectMapper, SecretSource secretSource) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.secretSource = secretSource;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Whisper client: baseUrl={}, model={}, language={}",
        properties.baseUrl(),
        properties.model(),
        properties.language());
  }

  @Override
  public void resolveCredentials() {
    secretSource.getSecret(properties.apiKeySecret());
  }

  @Override
  public WhisperResponse transcribe(byte[] audio, int chunkIndex) {
    LOGGER.debug("Transcribing chunk {}: {} bytes", chunkIndex, audio.length);

    String boundary = UUID.randomUUID().toString();
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/v1/audio/transcriptions"))
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Authorization", "Bearer " + secretSource.getSecret(properties.apiKeySecret()))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(BodyPublishers.ofByteArray(buildMultipartBody(audio, boundary)))
            .build();

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new WhisperException(
          String.format("Transcription request failed for chunk %d: %s", chunkIndex, e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException("Transcription interrupted for chunk " + chunkIndex, e);
    }

    if (response.statusCode() != 200) {
      Long resetHint =
          response
              .headers()
              .firstValue(RATE_LIMIT_RESET_HEADER)
              .map(WhisperApiClient::parseResetHint)
              .orElse(null);
      throw new WhisperException(
          String.format(
              "Whisper API returned status %d: %s", response.statusCode(), response.body()),
          response.statusCode(),
          resetHint);
    }

    WhisperResponse whisperResponse;
    try {
      whisperResponse = objectMapper.readValue(response.body(), WhisperResponse.class);
    } catch (IOException e) {
      throw new WhisperException("Failed to parse transcription response: " + e.getMessage(), e);
    }

    LOGGER.info(
        "Chunk {} transcribed: textLength={}, segments={}, duration={}s",
        chunkIndex,
        whisperResponse.text().length(),
        whisperResponse.segments().size(),
        whisperResponse.duration());

    return whisperResponse;
  }

  /**
   * Build a multipart/form-data body for the transcription request.
   *
   * <p>Java's HttpClient has no multipart support, so the parts are written by hand:
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="file"; filename="chunk.mp3"
   * Content-Type: audio/mpeg
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="model"
   *
   * whisper-1
   * ...
   * --boundary--
   * </pre>
   */
  private byte[] buildMultipartBody(byte[] audio, String boundary) {
    ByteArrayOutputStream body = new ByteArrayOutputStream(audio.length + 1024);

    writeAscii(body, "--" + boundary + "\r\n");
    writeAscii(body, "Content-Disposition: form-data; name=\"file\"; filename=\"chunk.mp3\"\r\n");
    writeAscii(body, "Content-Type: audio/mpeg\r\n\r\n");
    body.writeBytes(audio);
    writeAscii(body, "\r\n");

    writeField(body, boundary, "model", properties.model());
    writeField(body, boundary, "language", properties.language());
    writeField(body, boundary, "response_format", "verbose_json");
    writeField(body, boundary, "timestamp_granularities[]", "segment");

    writeAscii(body, "--" + boundary + "--\r\n");
    return body.toByteArray();
  }

  private static void writeField(
      ByteArrayOutputStream body, String boundary, String name, String value) {
    writeAscii(body, "--" + boundary + "\r\n");
    writeAscii(body, "Content-Disposition: form-data; name=\"" + name + "\"\r\n\r\n");
    writeAscii(body, value + "\r\n");
  }

  private static void writeAscii(ByteArrayOutputStream body, String text) {
    body.writeBytes(text.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Parse the rate limit reset hint into milliseconds.
   *
   * <p>Accepts a bare number of milliseconds ({@code "1500"}) or a Go-style duration ({@code
   * "20ms"}, {@code "1.5s"}, {@code "6m0s"}).
   *
   * @return the hint in milliseconds, or null if the value is not understood
   */
  static Long parseResetHint(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String trimmed = value.trim();
    if (trimmed.chars().allMatch(Character::isDigit)) {
      return Long.parseLong(trimmed);
    }

    Matcher matcher = DURATION_PART.matcher(trimmed);
    double totalMs = 0;
    int consumed = 0;
    while (matcher.find()) {
      if (matcher.start() != consumed) {
        return null;
      }
      double amount = Double.parseDouble(matcher.group(1));
      String unit = matcher.group(2);
      if (unit.equals("ms")) {
        totalMs += amount;
      } else if (unit.equals("s")) {
        totalMs += amount * 1000;
      } else if (unit.equals("m")) {
        totalMs += amount * 60_000;
      } else {
        totalMs += amount * 3_600_000;
      }
      consumed = matcher.end();
    }
    if (consumed == 0 || consumed != trimmed.length()) {
      LOGGER.debug("Unrecognised rate limit reset hint: {}", value);
      return null;
    }
    return Math.round(totalMs);
  }
}
