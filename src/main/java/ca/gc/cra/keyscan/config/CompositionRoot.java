package ca.gc.cra.keyscan.config;

import ca.gc.cra.keyscan.application.pipeline.KeyScanUseCase;
import ca.gc.cra.keyscan.application.port.CompositeMatcher;
import ca.gc.cra.keyscan.application.port.DumpReader;
import ca.gc.cra.keyscan.application.port.MetricsPort;
import ca.gc.cra.keyscan.application.port.PrimalityPort;
import ca.gc.cra.keyscan.application.port.ResultReporter;
import ca.gc.cra.keyscan.application.port.ScanObserver;
import ca.gc.cra.keyscan.infrastructure.dump.FileDumpReader;
import ca.gc.cra.keyscan.infrastructure.events.LoggingScanObserver;
import ca.gc.cra.keyscan.infrastructure.match.CompositeMatchers;
import ca.gc.cra.keyscan.infrastructure.math.JdkPrimalityAdapter;
import ca.gc.cra.keyscan.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.keyscan.infrastructure.report.JsonResultReporter;
import ca.gc.cra.keyscan.infrastructure.report.TextResultReporter;
import java.io.Writer;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the key scan use case to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate a {@link ScanConfig} into a runnable pipeline.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning dump reading, scanning, matching and reporting.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the matcher strategy and the output format.</li>
 *   <li>Share one metrics adapter and one scan observer across the pipeline.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration references; factory methods create new adapter
 * instances and are not synchronized.</p>
 * <p><strong>Performance:</strong> Invoked once during startup.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.keyscan.application.pipeline.KeyScanUseCase
 */
public final class CompositionRoot {
  private final ScanConfig config;
  private final MetricsPort metrics;
  private final ScanObserver observer;

  /**
   * Creates a composition root backed by the OpenTelemetry metrics adapter.
   *
   * @param config validated scan configuration; must not be {@code null}
   */
  public CompositionRoot(ScanConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics adapter.
   *
   * @param config validated scan configuration; must not be {@code null}
   * @param metricsPort metrics adapter used by constructed components; must not be {@code null}
   */
  public CompositionRoot(ScanConfig config, MetricsPort metricsPort) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metricsPort, "metricsPort");
    this.observer = new LoggingScanObserver(metrics);
  }

  /**
   * Builds the key scan use case writing its report to {@code out}.
   *
   * @param out destination for the report; not closed by the pipeline
   * @return wired use case
   */
  public KeyScanUseCase keyScanUseCase(Writer out) {
    return new KeyScanUseCase(
        config, dumpReader(), primality(), matcher(), observer, metrics, reporter(out));
  }

  /**
   * Creates the matcher selected by {@link ScanConfig#matcher()}.
   *
   * @return matcher strategy instance
   */
  public CompositeMatcher matcher() {
    return CompositeMatchers.create(
        config.matcher(), config.parallelism(), config.fingerprintWidth(), observer, metrics);
  }

  /**
   * Creates the reporter selected by {@link ScanConfig#format()}.
   *
   * @param out destination writer
   * @return reporter
   */
  public ResultReporter reporter(Writer out) {
    Objects.requireNonNull(out, "out");
    return switch (config.format()) {
      case JSON -> new JsonResultReporter(out);
      case TEXT -> new TextResultReporter(out);
    };
  }

  /**
   * Supplies the dump reader.
   *
   * @return file-backed reader
   */
  public DumpReader dumpReader() {
    return new FileDumpReader();
  }

  /**
   * Supplies the big-integer capability.
   *
   * @return JDK-backed primality adapter
   */
  public PrimalityPort primality() {
    return new JdkPrimalityAdapter();
  }

  /**
   * Supplies the metrics implementation shared by every component.
   *
   * @return metrics port
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Supplies the scan observer shared by every component.
   *
   * @return observer
   */
  public ScanObserver observer() {
    return observer;
  }

  /**
   * Returns the configuration this root was built from.
   *
   * @return scan configuration
   */
  public ScanConfig config() {
    return config;
  }
}
