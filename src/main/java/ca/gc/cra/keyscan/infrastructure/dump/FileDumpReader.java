package ca.gc.cra.keyscan.infrastructure.dump;

import ca.gc.cra.keyscan.application.port.DumpReader;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import ca.gc.cra.keyscan.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a dump file into a single heap buffer.
 *
 * <p>Files larger than the largest Java array are rejected rather than truncated.</p>
 *
 * @since 0.1.0
 */
public final class FileDumpReader implements DumpReader {
  private static final Logger log = LoggerFactory.getLogger(FileDumpReader.class);
  /** Largest array length the JVM reliably allocates. */
  static final long MAX_DUMP_BYTES = Integer.MAX_VALUE - 8L;

  private final long maxBytes;

  /**
   * Creates a reader accepting files up to the largest allocatable array.
   */
  public FileDumpReader() {
    this(MAX_DUMP_BYTES);
  }

  FileDumpReader(long maxBytes) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    this.maxBytes = maxBytes;
  }

  @Override
  public DumpBuffer read(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    Paths.requireReadableFile(path);
    long size = Files.size(path);
    if (size > maxBytes) {
      throw new IOException(
          "Dump " + path + " is " + size + " bytes; at most " + maxBytes + " bytes can be scanned in one buffer");
    }
    long started = System.nanoTime();
    byte[] data = Files.readAllBytes(path);
    log.debug(
        "Read {} bytes from {} in {} ms", data.length, path, (System.nanoTime() - started) / 1_000_000L);
    return DumpBuffer.wrap(data);
  }
}
