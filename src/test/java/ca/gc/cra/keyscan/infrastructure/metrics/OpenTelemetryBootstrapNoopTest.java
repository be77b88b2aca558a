package ca.gc.cra.keyscan.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
    System.clearProperty("otel.metric.export.interval");
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void noopAdapterIgnoresSignals() {
    previousExporter = System.getProperty("otel.metrics.exporter");
    System.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      assertTrue(adapter.isNoop());
      adapter.increment("scan.primes.confirmed");
      adapter.observe("index.pairs", 3);
    }
  }

  @Test
  void resourceAttributesSkipMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes("deployment.environment=lab, broken, =x, team=ir");

    assertEquals(2, attributes.size());
    assertEquals("lab", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("ir", attributes.get(AttributeKey.stringKey("team")));
  }

  @Test
  void exportIntervalHonoursPropertyAndRejectsGarbage() {
    System.setProperty("otel.metric.export.interval", "250");
    assertEquals(Duration.ofMillis(250), OpenTelemetryBootstrap.exportInterval());

    System.setProperty("otel.metric.export.interval", "soon");
    assertEquals(Duration.ofSeconds(5), OpenTelemetryBootstrap.exportInterval());

    System.setProperty("otel.metric.export.interval", "-1");
    assertEquals(Duration.ofSeconds(5), OpenTelemetryBootstrap.exportInterval());
  }
}
