package com.scholary.audio.segmenter.topics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.audio.segmenter.secrets.SecretSource;
import com.scholary.audio.segmenter.transcript.Timecodes;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Segmentation client for an OpenAI-compatible chat completions endpoint.
 *
 * <p>Sends the prompt as a single user message and asks for a JSON object response. The content of
 * the first choice must parse into a {@link TopicAnalysis} in which every segment has all four
 * fields and valid {@code MM:SS} times. Anything else is a {@link SegmentationException}.
 */
@Component
public class ChatSegmentationClient implements SegmentationClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChatSegmentationClient.class);

  private final HttpClient httpClient;
  private final SegmentationProperties properties;
  private final ObjectMapper objectMapper;
  private final SecretSource secretSource;

  public ChatSegmentationClient(
      SegmentationProperties properties, ObjectMapper objectMapper, SecretSource secretSource) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.secretSource = secretSource;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized segmentation client: baseUrl={}, model={}, temperature={}",
        properties.baseUrl(),
        properties.model(),
        properties.temperature());
  }

  @Override
  public TopicAnalysis requestSegments(String prompt) {
    HttpRequest request;
    try {
      request =
          HttpRequest.newBuilder()
              .uri(URI.create(properties.baseUrl() + "/chat/completions"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header(
                  "Authorization", "Bearer " + secretSource.getSecret(properties.apiKeySecret()))
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofString(buildRequestBody(prompt)))
              .build();
    } catch (JsonProcessingException e) {
      throw new SegmentationException("Failed to build segmentation request", e);
    }

    LOGGER.debug("Requesting topic segments: promptLength={}", prompt.length());
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new SegmentationException("Segmentation request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SegmentationException("Segmentation request interrupted", e);
    }

    if (response.statusCode() != 200) {
      throw new SegmentationException(
          String.format(
              "Segmentation API returned status %d: %s", response.statusCode(), response.body()));
    }

    TopicAnalysis analysis = parseResponse(response.body());
    LOGGER.info("Received {} topic segments", analysis.segments().size());
    return analysis;
  }

  private String buildRequestBody(String prompt) throws JsonProcessingException {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("model", properties.model());
    body.put("temperature", properties.temperature());
    body.putObject("response_format").put("type", "json_object");
    ObjectNode message = body.putArray("messages").addObject();
    message.put("role", "user");
    message.put("content", prompt);
    return objectMapper.writeValueAsString(body);
  }

  TopicAnalysis parseResponse(String body) {
    String content;
    try {
      JsonNode root = objectMapper.readTree(body);
      content = root.path("choices").path(0).path("message").path("content").asText(null);
    } catch (JsonProcessingException e) {
      throw new SegmentationException("Segmentation response is not valid JSON", e);
    }
    if (content == null || content.isBlank()) {
      throw new SegmentationException("Segmentation response has no message content");
    }

    TopicAnalysis analysis;
    try {
      analysis = objectMapper.readValue(stripCodeFence(content), TopicAnalysis.class);
    } catch (JsonProcessingException e) {
      throw new SegmentationException(
          "Segmentation content is not a valid segment list: " + e.getOriginalMessage(), e);
    }
    validate(analysis);
    return analysis;
  }

  private static void validate(TopicAnalysis analysis) {
    if (analysis == null || analysis.segments() == null) {
      throw new SegmentationException("Segmentation content has no segments array");
    }
    for (int i = 0; i < analysis.segments().size(); i++) {
      TopicSegment segment = analysis.segments().get(i);
      if (segment == null
          || isBlank(segment.startTime())
          || isBlank(segment.endTime())
          || isBlank(segment.topic())
          || segment.description() == null) {
        throw new SegmentationException("Segment " + i + " is missing required fields");
      }
      try {
        Timecodes.parse(segment.startTime());
        Timecodes.parse(segment.endTime());
      } catch (IllegalArgumentException e) {
        throw new SegmentationException("Segment " + i + " has an invalid time", e);
      }
    }
  }

  /** Some models wrap JSON in a markdown fence even in JSON mode. */
  private static String stripCodeFence(String content) {
    String trimmed = content.trim();
    if (!trimmed.startsWith("```")) {
      return trimmed;
    }
    int firstNewline = trimmed.indexOf('\n');
    int closing = trimmed.lastIndexOf("```");
    if (firstNewline < 0 || closing <= firstNewline) {
      return trimmed;
    }
    return trimmed.substring(firstNewline + 1, closing).trim();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
