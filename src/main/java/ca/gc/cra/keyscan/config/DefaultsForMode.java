package ca.gc.cra.keyscan.config;

import ca.gc.cra.keyscan.application.pipeline.PrimeVolumeGuard;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import ca.gc.cra.keyscan.domain.scan.OrderPolicy;
import ca.gc.cra.keyscan.infrastructure.match.RollingHashMatcher;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each keyscan CLI mode.
 *
 * <p>Required settings ({@code in}, {@code primeSize}, {@code nullFilterLength}) have no default.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target CLI mode ({@code scan} or {@code primes})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "scan" -> buildScanDefaults();
      case "primes" -> buildPrimesDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildScanDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dumpPrimes", "false");
    map.put("matcher", MatcherStrategy.AUTOMATON.cliName());
    map.put("byteOrder", OrderPolicy.BOTH.name().toLowerCase(Locale.ROOT));
    map.put("stage1Rounds", Integer.toString(ScanConfig.DEFAULT_STAGE1_ROUNDS));
    map.put("stage2Rounds", Integer.toString(ScanConfig.DEFAULT_STAGE2_ROUNDS));
    map.put("primeWarnThreshold", Integer.toString(PrimeVolumeGuard.DEFAULT_WARN_THRESHOLD));
    map.put("maxPrimes", "0");
    map.put("parallelism", Integer.toString(ScanConfig.defaultParallelism()));
    map.put("fingerprintWidth", Integer.toString(RollingHashMatcher.DEFAULT_FINGERPRINT_WIDTH));
    map.put("format", ScanConfig.OutputFormat.TEXT.optionValue());
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildPrimesDefaults() {
    Map<String, String> map = buildScanDefaults();
    map.put("dumpPrimes", "true");
    return map;
  }
}
