package com.scholary.audio.segmenter.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A single timestamped segment of a chunk's transcript.
 *
 * <p>Times are seconds relative to the start of the chunk the segment came from, not to the full
 * recording.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TranscriptSegment(double start, double end, String text) {}
