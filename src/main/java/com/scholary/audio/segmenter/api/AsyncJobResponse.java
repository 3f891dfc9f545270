package com.scholary.audio.segmenter.api;

/** Response for an accepted transcription request: the ID to poll. */
public record AsyncJobResponse(String jobId) {}
