package ca.gc.cra.keyscan.api;

import ca.gc.cra.keyscan.application.pipeline.CancellationToken;
import ca.gc.cra.keyscan.application.pipeline.KeyScanUseCase;
import ca.gc.cra.keyscan.application.pipeline.ScanAbortedException;
import ca.gc.cra.keyscan.application.pipeline.ScanReport;
import ca.gc.cra.keyscan.config.CompositionRoot;
import ca.gc.cra.keyscan.config.ConfigMerger;
import ca.gc.cra.keyscan.config.DefaultsForMode;
import ca.gc.cra.keyscan.config.ScanConfig;
import ca.gc.cra.keyscan.config.YamlConfigLoader;
import ca.gc.cra.keyscan.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.keyscan.logging.LoggingConfigurator;
import ca.gc.cra.keyscan.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for scanning a memory dump for RSA primes and the moduli built from them.
 *
 * <p>The {@code primes} mode runs the same pipeline with {@code dumpPrimes=true}.</p>
 *
 * @since 0.1.0
 */
public final class ScanCli {
  private static final Logger log = LoggerFactory.getLogger(ScanCli.class);
  private static final String SUMMARY_USAGE =
      "usage: scan in=PATH primeSize=N nullFilterLength=N [matcher=naive|automaton|rolling-hash] "
          + "[byteOrder=both|msf|lsf] [stage1Rounds=N] [stage2Rounds=N] [primeWarnThreshold=N] "
          + "[maxPrimes=N] [parallelism=N] [fingerprintWidth=N] [format=text|json] [config=PATH] "
          + "[--dump-primes] [--dry-run] [metricsExporter=otlp|none] [otelEndpoint=URL] "
          + "[otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      keyscan scan

      Usage:
        scan in=./core.dump primeSize=128 nullFilterLength=2 [options]
        scan ./core.dump s=128 f=2 [options]

      Required:
        in=PATH                   Memory dump to scan (a bare PATH also works)
        primeSize=1-65536         Byte width of one prime (alias s=, prime-size=)
        nullFilterLength=1-65536  Zero-run length that disqualifies a window (alias f=, null-filter-length=)

      Optional:
        matcher=NAME              naive, automaton or rolling-hash (default automaton)
        byteOrder=both|msf|lsf    Byte orders each window is read in (default both)
        stage1Rounds=1-64         Rounds of the cheap primality test (default 1)
        stage2Rounds=N            Rounds of the confirming test, >= stage1Rounds, <= 128 (default 20)
        primeWarnThreshold=N      Warn when more primes than this are confirmed (default 1000)
        maxPrimes=N               Abort when more primes than this are confirmed (default 0, disabled)
        parallelism=1-1024        Worker threads (default available processors)
        fingerprintWidth=1-64     Rolling-hash window in bytes (default 8)
        format=text|json          Result format on stdout (default text)
        config=PATH               YAML file with common and scan sections
        --dump-primes, -p         Print confirmed primes and skip modulus matching
        --dry-run                 Validate inputs and print the plan without scanning
        metricsExporter=otlp|none Configure metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Notes:
        Results go to stdout; logs go to stderr.
        Recovered primes are private key material. Protect the output accordingly.
      """;

  private ScanCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the full scan.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    return run("scan", args);
  }

  /**
   * Runs the prime scan only.
   *
   * @param args raw CLI arguments
   * @return exit code capturing the outcome
   */
  static ExitCode runPrimes(String[] args) {
    return run("primes", args);
  }

  private static ExitCode run(String mode, String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} CLI", mode);
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.dumpPrimes()) {
      kv.put("dumpPrimes", "true");
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> configInputs;
    ScanConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          mode, yamlConfig, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
      }
      configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      config = ScanConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Paths.requireReadableFile(config.input());
    } catch (IOException ex) {
      log.error("Dump file is not readable: {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    }

    boolean dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(configInputs, "dryRun");
    if (dryRun) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    CancellationToken cancellation = new CancellationToken();
    ScanShutdownHook shutdown = new ScanShutdownHook(cancellation, ScanShutdownHook.DEFAULT_GRACE);
    Thread hook = new Thread(shutdown, "keyscan-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      KeyScanUseCase useCase = root.keyScanUseCase(CliPrinter.stdout());
      ScanReport report = useCase.run(cancellation);
      log.info(
          "Scan of {} completed: {} primes, {} matches",
          config.input(),
          report.primes().size(),
          report.matches().size());
      return ExitCode.SUCCESS;
    } catch (ScanAbortedException ex) {
      return switch (ex.reason()) {
        case CANCELLED -> {
          log.error("Scan of {} cancelled; no results reported", config.input());
          yield ExitCode.INTERRUPTED;
        }
        case NO_WINDOWS, PRIME_LIMIT_EXCEEDED -> {
          log.error("Scan of {} aborted: {}", config.input(), ex.getMessage());
          yield ExitCode.PRECONDITION_FAILED;
        }
      };
    } catch (IllegalArgumentException ex) {
      log.error("Scan configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Scan I/O failure while processing {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in scan pipeline", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      shutdown.scanFinished();
      removeHook(hook);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; keeping cancellation hook");
    }
  }

  private static void printDryRunPlan(ScanConfig config) {
    CliPrinter.printLines(
        "Scan dry-run: the dump will not be scanned.",
        " Input             : " + config.input(),
        " Prime size        : " + config.primeSize() + " bytes",
        " Null filter       : " + config.nullFilterLength() + " bytes",
        " Mode              : " + (config.dumpPrimes() ? "primes only" : "primes and moduli"),
        " Matcher           : " + (config.dumpPrimes() ? "<none>" : config.matcher().cliName()),
        " Byte order        : " + config.byteOrder(),
        " Primality rounds  : " + config.stage1Rounds() + " then " + config.stage2Rounds(),
        " Prime warn/max    : " + config.primeWarnThreshold() + " / "
            + (config.maxPrimes() == 0 ? "unlimited" : Integer.toString(config.maxPrimes())),
        " Parallelism       : " + config.parallelism(),
        " Output format     : " + config.format().optionValue(),
        " Re-run without --dry-run to scan.");
  }
}
