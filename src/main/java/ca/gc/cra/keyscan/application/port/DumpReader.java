package ca.gc.cra.keyscan.application.port;

import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads a dump fully into memory.
 *
 * @since 0.1.0
 */
public interface DumpReader {

  /**
   * Reads the complete contents of {@code path}.
   *
   * @param path dump file
   * @return buffer owning the file contents
   * @throws IOException when the file cannot be read or is too large to hold in one buffer
   */
  DumpBuffer read(Path path) throws IOException;
}
