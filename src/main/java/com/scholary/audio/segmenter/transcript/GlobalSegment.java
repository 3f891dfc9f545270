package com.scholary.audio.segmenter.transcript;

/**
 * A transcript segment placed on the timeline of the full recording.
 *
 * <p>{@code start} and {@code end} are absolute seconds; {@code sourceChunkIndex} is the chunk the
 * segment was transcribed from.
 */
public record GlobalSegment(String text, double start, double end, int sourceChunkIndex) {}
