package ca.gc.cra.keyscan.infrastructure.report;

import ca.gc.cra.keyscan.application.pipeline.ScanReport;
import ca.gc.cra.keyscan.application.pipeline.ScanStats;
import ca.gc.cra.keyscan.application.port.ResultReporter;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Writes results as a single JSON document.
 *
 * <p>Integers are written as decimal strings so consumers without arbitrary-precision numbers read them intact.
 * Primes-only runs produce a {@code primes} array, full runs a {@code matches} array; both carry {@code stats}.</p>
 *
 * @since 0.1.0
 */
public final class JsonResultReporter implements ResultReporter {
  private final JsonFactory jsonFactory = new JsonFactory();
  private final Writer out;

  /**
   * Creates a reporter writing to {@code out}. The writer is flushed but not closed.
   *
   * @param out destination
   */
  public JsonResultReporter(Writer out) {
    this.out = Objects.requireNonNull(out, "out");
    jsonFactory.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
  }

  @Override
  public void report(ScanReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.useDefaultPrettyPrinter();
      gen.writeStartObject();
      if (report.primesOnly()) {
        gen.writeArrayFieldStart("primes");
        for (BigInteger prime : report.primes()) {
          gen.writeString(prime.toString());
        }
        gen.writeEndArray();
      } else {
        gen.writeStringField("matcher", report.strategy().cliName());
        gen.writeArrayFieldStart("matches");
        for (MatchResult match : report.matches()) {
          gen.writeStartObject();
          gen.writeStringField("p", match.p().toString());
          gen.writeStringField("q", match.q().toString());
          gen.writeStringField("n", match.n().toString());
          gen.writeEndObject();
        }
        gen.writeEndArray();
      }
      writeStats(gen, report.stats());
      gen.writeEndObject();
    }
    out.write(System.lineSeparator());
    out.flush();
  }

  private static void writeStats(JsonGenerator gen, ScanStats stats) throws IOException {
    gen.writeObjectFieldStart("stats");
    gen.writeNumberField("windowsVisited", stats.windowsVisited());
    gen.writeNumberField("windowsNullRun", stats.windowsNullRun());
    gen.writeNumberField("stage1Rejected", stats.stage1Rejected());
    gen.writeNumberField("stage2Rejected", stats.stage2Rejected());
    gen.writeNumberField("primesConfirmed", stats.primesConfirmed());
    gen.writeNumberField("pairs", stats.pairs());
    gen.writeNumberField("indexKeys", stats.indexKeys());
    gen.writeNumberField("keysRejected", stats.keysRejected());
    gen.writeNumberField("matches", stats.matches());
    gen.writeEndObject();
  }
}
