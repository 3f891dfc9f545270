package com.scholary.audio.segmenter.chunking;

import com.scholary.audio.segmenter.config.TranscriptionProperties;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Reads a single chunk's bytes from the local audio file.
 *
 * <p>Only the requested range is read, into a buffer sized to the chunk. The full file is never
 * held in memory, so peak usage is bounded by the chunk size times the batch concurrency.
 *
 * <p>Slices below {@code minChunkBytes} are not returned. Such fragments are usually shorter than a
 * single audio frame and come back from the transcription service as malformed requests.
 */
@Component
public class ChunkFetcher {

  public static final int DEFAULT_MIN_CHUNK_BYTES = 4096;

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkFetcher.class);

  private final int minChunkBytes;

  @Autowired
  public ChunkFetcher(TranscriptionProperties properties) {
    this(properties.chunking().minChunkBytes());
  }

  public ChunkFetcher(int minChunkBytes) {
    this.minChunkBytes = minChunkBytes;
  }

  /**
   * Read the bytes of a chunk.
   *
   * @param audioPath the local audio file
   * @param chunk the byte range to read
   * @return the chunk bytes, or empty if the range is too small to transcribe
   * @throws IOException if the file cannot be read or ends before the range does
   */
  public Optional<byte[]> fetch(Path audioPath, ChunkSpec chunk) throws IOException {
    if (isTooSmall(chunk)) {
      LOGGER.info(
          "Chunk {} is {} bytes (< {}), skipping", chunk.index(), chunk.length(), minChunkBytes);
      return Optional.empty();
    }

    ByteBuffer buffer = ByteBuffer.allocate(Math.toIntExact(chunk.length()));
    try (FileChannel channel = FileChannel.open(audioPath, StandardOpenOption.READ)) {
      long position = chunk.startByte();
      while (buffer.hasRemaining()) {
        int read = channel.read(buffer, position);
        if (read < 0) {
          throw new EOFException(
              String.format(
                  "Unexpected end of file reading chunk %d at byte %d (expected end %d)",
                  chunk.index(), position, chunk.endByte()));
        }
        position += read;
      }
    }

    LOGGER.debug(
        "Read chunk {}: bytes {}-{} ({} KB)",
        chunk.index(),
        chunk.startByte(),
        chunk.endByte(),
        chunk.length() / 1024);
    return Optional.of(buffer.array());
  }

  public boolean isTooSmall(ChunkSpec chunk) {
    return chunk.length() < minChunkBytes;
  }
}
