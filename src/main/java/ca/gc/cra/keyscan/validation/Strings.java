package ca.gc.cra.keyscan.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Validation utilities for strings supplied through the CLI and YAML configuration.
 * <p><strong>Why:</strong> Ensures option values are free of control characters and blanks before they select
 * matchers, output formats or exporters.
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Normalizes a value to lower case and checks it against a closed set of choices.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param choices accepted lower-case values
   * @return normalized value
   * @throws IllegalArgumentException if the value is blank or not one of {@code choices}
   */
  public static String requireOneOf(String name, String value, String... choices) {
    String normalized = requireNonBlank(name, value).toLowerCase(Locale.ROOT);
    for (String choice : choices) {
      if (choice.equals(normalized)) {
        return normalized;
      }
    }
    throw new IllegalArgumentException(
        message(name, "must be one of " + String.join("|", choices) + " (was '" + value.trim() + "')"));
  }

  /**
   * Ensures the value is printable ASCII and no longer than {@code maxLength}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate text
   * @param maxLength maximum accepted length after trimming
   * @return trimmed input
   * @throws IllegalArgumentException if the value is blank, too long, or contains non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    if (!trimmed.chars().allMatch(c -> c >= 0x20 && c <= 0x7E)) {
      throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
