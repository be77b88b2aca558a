package ca.gc.cra.keyscan.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.keyscan.application.pipeline.ScanReport;
import ca.gc.cra.keyscan.application.pipeline.ScanStats;
import ca.gc.cra.keyscan.domain.scan.MatchResult;
import ca.gc.cra.keyscan.domain.scan.MatcherStrategy;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.StringWriter;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonResultReporterTest {
  private static final ScanStats STATS = new ScanStats(10, 2, 5, 1, 2, 3, 6, 0, 1);

  @Test
  void matchesAreWrittenAsDecimalStrings() throws IOException {
    StringWriter out = new StringWriter();
    BigInteger p = new BigInteger("4294967279");
    BigInteger q = new BigInteger("4294967291");
    MatchResult match = new MatchResult(p, q, p.multiply(q));

    new JsonResultReporter(out)
        .report(ScanReport.withMatches(List.of(p, q), List.of(match), MatcherStrategy.ROLLING_HASH, STATS));

    Map<String, String> strings = new HashMap<>();
    Map<String, Long> numbers = new HashMap<>();
    List<String> arrays = new ArrayList<>();
    try (JsonParser parser = new JsonFactory().createParser(out.toString())) {
      while (parser.nextToken() != null) {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.START_ARRAY) {
          arrays.add(parser.currentName());
        } else if (token == JsonToken.VALUE_STRING) {
          strings.put(parser.currentName(), parser.getText());
        } else if (token == JsonToken.VALUE_NUMBER_INT) {
          numbers.put(parser.currentName(), parser.getLongValue());
        }
      }
    }

    assertEquals(List.of("matches"), arrays);
    assertEquals("rolling-hash", strings.get("matcher"));
    assertEquals("4294967279", strings.get("p"));
    assertEquals("4294967291", strings.get("q"));
    assertEquals(p.multiply(q).toString(), strings.get("n"));
    assertEquals(10L, numbers.get("windowsVisited"));
    assertEquals(3L, numbers.get("pairs"));
    assertEquals(1L, numbers.get("matches"));
  }

  @Test
  void primesOnlyRunsWritePrimesArray() throws IOException {
    StringWriter out = new StringWriter();

    new JsonResultReporter(out)
        .report(ScanReport.primesOnly(List.of(BigInteger.valueOf(65_521), BigInteger.valueOf(251)), STATS));

    String json = out.toString();
    assertTrue(json.contains("\"primes\""), json);
    assertTrue(json.indexOf("\"251\"") < json.indexOf("\"65521\""), json);
    assertFalse(json.contains("\"matcher\""), json);
    assertTrue(json.endsWith(System.lineSeparator()));
  }
}
