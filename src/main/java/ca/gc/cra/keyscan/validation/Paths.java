package ca.gc.cra.keyscan.validation;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for dump and configuration paths.
 * <p><strong>Why:</strong> Turns operator-supplied path strings into normalized paths and reports unreadable
 * inputs with a precise cause before any large allocation happens.
 * <p><strong>Thread-safety:</strong> Stateless methods; results reflect the filesystem at the time of the call.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Parses and normalizes a path supplied as text.
   *
   * @param name logical parameter name for diagnostics
   * @param value raw path text
   * @return absolute normalized path
   * @throws IllegalArgumentException if the text is blank, contains null bytes, or is not a valid path
   */
  public static Path parse(String name, String value) {
    String raw = Strings.requireNonBlank(name, value);
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    try {
      return Path.of(raw).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + raw, ex);
    }
  }

  /**
   * Confirms that {@code path} names a readable regular file.
   *
   * @param path candidate file; must not be {@code null}
   * @return the same path
   * @throws NoSuchFileException if the file does not exist or is not a regular file
   * @throws AccessDeniedException if the file cannot be read
   * @throws IOException if the file attributes cannot be read
   */
  public static Path requireReadableFile(Path path) throws IOException {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    if (!Files.exists(path)) {
      throw new NoSuchFileException(path.toString());
    }
    if (!Files.isRegularFile(path)) {
      throw new NoSuchFileException(path.toString(), null, "not a regular file");
    }
    if (!Files.isReadable(path)) {
      throw new AccessDeniedException(path.toString());
    }
    return path;
  }
}
