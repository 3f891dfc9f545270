package com.scholary.audio.segmenter.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Request for transcribing an audio object.
 *
 * <p>The audio is read from {@code audioBucket/audioKey}. {@code fileKey} is the key of the
 * original upload the audio was extracted from; it names the output documents and is recorded in
 * their metadata. Results are written to {@code outputBucket}.
 */
public record TranscriptionRequest(
    @NotBlank String audioBucket,
    @NotBlank String audioKey,
    @NotBlank String fileKey,
    @NotBlank String outputBucket,
    @Valid ContentMetadata metadata,
    String fileExtension) {

  public TranscriptionRequest {
    if (metadata == null) {
      metadata = new ContentMetadata(null, null, null, null, null);
    }
    if ((fileExtension == null || fileExtension.isBlank()) && fileKey != null) {
      int dot = fileKey.lastIndexOf('.');
      fileExtension = dot >= 0 && dot > fileKey.lastIndexOf('/') ? fileKey.substring(dot + 1) : "";
    }
  }

  /** Catalogue fields copied onto the output objects' metadata. */
  public record ContentMetadata(
      String contentId,
      String type,
      String title,
      String parentId,
      @PositiveOrZero Integer orderIndex) {}
}
