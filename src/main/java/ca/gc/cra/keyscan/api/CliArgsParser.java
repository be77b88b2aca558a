package ca.gc.cra.keyscan.api;

import ca.gc.cra.keyscan.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} CLI arguments into a lookup map.
 *
 * <p>Short and dashed aliases are rewritten to their configuration keys ({@code s} and {@code prime-size} become
 * {@code primeSize}; {@code f} and {@code null-filter-length} become {@code nullFilterLength}). A single token
 * without {@code '='} names the input dump.</p>
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");
  private static final Map<String, String> ALIASES =
      Map.of(
          "s", "primeSize",
          "prime-size", "primeSize",
          "f", "nullFilterLength",
          "null-filter-length", "nullFilterLength",
          "file", "in",
          "dump-primes", "dumpPrimes");

  private CliArgsParser() {}

  /**
   * Converts command-line arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map keyed by the canonical option name
   * @throws IllegalArgumentException on malformed tokens, repeated positional inputs or invalid names
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    boolean positionalSeen = false;
    for (String raw : args) {
      if (raw == null || raw.isBlank()) {
        continue;
      }
      String arg = raw.trim();
      int idx = arg.indexOf('=');
      if (idx < 0) {
        if (positionalSeen) {
          throw new IllegalArgumentException("only one input file may be given (extra '" + arg + "')");
        }
        positionalSeen = true;
        validateValue("in", arg);
        map.put("in", arg);
        continue;
      }
      if (idx == 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      map.put(ALIASES.getOrDefault(key, key), value);
    }
    return map;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (value.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("argument " + key + " must not contain null bytes");
    }
    Strings.requireNonBlank(key, value);
  }
}
