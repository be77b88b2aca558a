package ca.gc.cra.keyscan.config;

import ca.gc.cra.keyscan.application.pipeline.PrimeVolumeGuard;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import ca.gc.cra.keyscan.domain.scan.OrderPolicy;
import ca.gc.cra.keyscan.infrastructure.match.RollingHashMatcher;
import ca.gc.cra.keyscan.validation.Numbers;
import ca.gc.cra.keyscan.validation.Paths;
import ca.gc.cra.keyscan.validation.Strings;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated settings for one scan run.
 * <p><strong>Why:</strong> Collects CLI, YAML and default values into one immutable value so that every
 * configuration error surfaces before the dump is read.</p>
 * <p><strong>Role:</strong> Configuration aggregate consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param input dump file to scan
 * @param primeSize byte width of one prime window
 * @param nullFilterLength zero-run length that excludes a window
 * @param dumpPrimes when {@code true} only confirmed primes are reported and matching is skipped
 * @param matcher composite matcher strategy
 * @param byteOrder byte orders each window is decoded in
 * @param stage1Rounds rounds of the cheap primality test
 * @param stage2Rounds rounds of the confirming primality test; at least {@code stage1Rounds}
 * @param primeWarnThreshold confirmed prime count above which an advisory is raised
 * @param maxPrimes confirmed prime ceiling; {@code 0} disables it
 * @param parallelism worker thread count
 * @param fingerprintWidth rolling-hash fingerprint width in bytes
 * @param format result output format
 * @since 0.1.0
 * @see ca.gc.cra.keyscan.application.pipeline.KeyScanUseCase
 */
public record ScanConfig(
    Path input,
    int primeSize,
    int nullFilterLength,
    boolean dumpPrimes,
    MatcherStrategy matcher,
    OrderPolicy byteOrder,
    int stage1Rounds,
    int stage2Rounds,
    int primeWarnThreshold,
    int maxPrimes,
    int parallelism,
    int fingerprintWidth,
    OutputFormat format) {

  /** Largest accepted prime or zero-run width in bytes. */
  public static final int MAX_WIDTH = 65_536;
  /** Default cheap-test rounds. */
  public static final int DEFAULT_STAGE1_ROUNDS = 1;
  /** Default confirming-test rounds. */
  public static final int DEFAULT_STAGE2_ROUNDS = 20;

  /**
   * Validates ranges and cross-field constraints.
   *
   * @throws IllegalArgumentException when a value is out of range
   */
  public ScanConfig {
    Objects.requireNonNull(input, "input");
    Numbers.requireRange("primeSize", primeSize, 1, MAX_WIDTH);
    Numbers.requireRange("nullFilterLength", nullFilterLength, 1, MAX_WIDTH);
    matcher = Objects.requireNonNullElse(matcher, MatcherStrategy.AUTOMATON);
    byteOrder = Objects.requireNonNullElse(byteOrder, OrderPolicy.BOTH);
    Numbers.requireRange("stage1Rounds", stage1Rounds, 1, 64);
    Numbers.requireRange("stage2Rounds", stage2Rounds, stage1Rounds, 128);
    Numbers.requireRange("primeWarnThreshold", primeWarnThreshold, 0, Integer.MAX_VALUE);
    Numbers.requireRange("maxPrimes", maxPrimes, 0, Integer.MAX_VALUE);
    Numbers.requireRange("parallelism", parallelism, 1, 1024);
    Numbers.requireRange("fingerprintWidth", fingerprintWidth, 1, 64);
    format = Objects.requireNonNullElse(format, OutputFormat.TEXT);
  }

  /**
   * Creates a configuration with defaults for every optional setting.
   *
   * @param input dump file
   * @param primeSize byte width of one prime
   * @param nullFilterLength zero-run length that excludes a window
   * @return configuration
   */
  public static ScanConfig of(Path input, int primeSize, int nullFilterLength) {
    return new ScanConfig(
        input,
        primeSize,
        nullFilterLength,
        false,
        MatcherStrategy.AUTOMATON,
        OrderPolicy.BOTH,
        DEFAULT_STAGE1_ROUNDS,
        DEFAULT_STAGE2_ROUNDS,
        PrimeVolumeGuard.DEFAULT_WARN_THRESHOLD,
        0,
        defaultParallelism(),
        RollingHashMatcher.DEFAULT_FINGERPRINT_WIDTH,
        OutputFormat.TEXT);
  }

  /**
   * Creates a configuration from flattened key/value pairs.
   *
   * @param options keys such as {@code in}, {@code primeSize}, {@code nullFilterLength}, {@code matcher}
   * @return populated configuration
   * @throws IllegalArgumentException when values are invalid or required settings are missing
   */
  public static ScanConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String in = firstNonBlank(options, "in", "file");
    if (in == null) {
      throw new IllegalArgumentException("in is required");
    }
    String primeSize = firstNonBlank(options, "primeSize");
    if (primeSize == null) {
      throw new IllegalArgumentException("primeSize is required");
    }
    String nullFilterLength = firstNonBlank(options, "nullFilterLength");
    if (nullFilterLength == null) {
      throw new IllegalArgumentException("nullFilterLength is required");
    }
    int stage1 = intOption(options, "stage1Rounds", DEFAULT_STAGE1_ROUNDS, 1, 64);
    return new ScanConfig(
        Paths.parse("in", in),
        Numbers.parseInt("primeSize", primeSize, 1, MAX_WIDTH),
        Numbers.parseInt("nullFilterLength", nullFilterLength, 1, MAX_WIDTH),
        parseBoolean(options.get("dumpPrimes"), false),
        optional(options, "matcher").map(MatcherStrategy::parse).orElse(MatcherStrategy.AUTOMATON),
        optional(options, "byteOrder").map(OrderPolicy::parse).orElse(OrderPolicy.BOTH),
        stage1,
        intOption(options, "stage2Rounds", Math.max(stage1, DEFAULT_STAGE2_ROUNDS), 1, 128),
        intOption(options, "primeWarnThreshold", PrimeVolumeGuard.DEFAULT_WARN_THRESHOLD, 0, Integer.MAX_VALUE),
        intOption(options, "maxPrimes", 0, 0, Integer.MAX_VALUE),
        intOption(options, "parallelism", defaultParallelism(), 1, 1024),
        intOption(options, "fingerprintWidth", RollingHashMatcher.DEFAULT_FINGERPRINT_WIDTH, 1, 64),
        optional(options, "format").map(OutputFormat::parse).orElse(OutputFormat.TEXT));
  }

  /**
   * Returns a copy reporting only confirmed primes.
   *
   * @return configuration with {@code dumpPrimes=true}
   */
  public ScanConfig withDumpPrimes() {
    return new ScanConfig(
        input,
        primeSize,
        nullFilterLength,
        true,
        matcher,
        byteOrder,
        stage1Rounds,
        stage2Rounds,
        primeWarnThreshold,
        maxPrimes,
        parallelism,
        fingerprintWidth,
        format);
  }

  /**
   * Returns a copy using {@code strategy}.
   *
   * @param strategy matcher strategy
   * @return configuration with the given matcher
   */
  public ScanConfig withMatcher(MatcherStrategy strategy) {
    return new ScanConfig(
        input,
        primeSize,
        nullFilterLength,
        dumpPrimes,
        strategy,
        byteOrder,
        stage1Rounds,
        stage2Rounds,
        primeWarnThreshold,
        maxPrimes,
        parallelism,
        fingerprintWidth,
        format);
  }

  /**
   * Returns a copy using {@code workers} threads.
   *
   * @param workers worker thread count
   * @return configuration with the given parallelism
   */
  public ScanConfig withParallelism(int workers) {
    return new ScanConfig(
        input,
        primeSize,
        nullFilterLength,
        dumpPrimes,
        matcher,
        byteOrder,
        stage1Rounds,
        stage2Rounds,
        primeWarnThreshold,
        maxPrimes,
        workers,
        fingerprintWidth,
        format);
  }

  /**
   * Returns the worker count used when none is configured.
   *
   * @return available processors, capped at 1024
   */
  public static int defaultParallelism() {
    return Math.min(1024, Math.max(1, Runtime.getRuntime().availableProcessors()));
  }

  /** Result output formats. */
  public enum OutputFormat {
    /** Plain text lines. */
    TEXT,
    /** A single JSON document. */
    JSON;

    /**
     * Parses {@code text} or {@code json}.
     *
     * @param raw format name
     * @return format
     * @throws IllegalArgumentException for unknown names
     */
    public static OutputFormat parse(String raw) {
      return switch (Strings.requireOneOf("format", raw, "text", "json")) {
        case "json" -> JSON;
        default -> TEXT;
      };
    }

    /**
     * Returns the lower-case option value.
     *
     * @return {@code text} or {@code json}
     */
    public String optionValue() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  private static int intOption(Map<String, String> options, String key, int defaultValue, int min, int max) {
    return optional(options, key).map(value -> Numbers.parseInt(key, value, min, max)).orElse(defaultValue);
  }

  private static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static String firstNonBlank(Map<String, String> map, String... keys) {
    for (String key : keys) {
      String val = map.get(key);
      if (val != null && !val.isBlank()) {
        return val;
      }
    }
    return null;
  }
}
