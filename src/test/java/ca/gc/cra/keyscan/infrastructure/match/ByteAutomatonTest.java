package ca.gc.cra.keyscan.infrastructure.match;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.keyscan.domain.scan.ByteKey;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

class ByteAutomatonTest {

  @Test
  void reportsOverlappingAndNestedPatterns() {
    ByteAutomaton automaton = ByteAutomaton.build(List.of(key("he"), key("she"), key("his"), key("hers")));
    DumpBuffer buffer = DumpBuffer.wrap("ushers".getBytes(StandardCharsets.US_ASCII));

    List<String> hits = new ArrayList<>();
    automaton.search(buffer, 0, buffer.length(), buffer.length(), (start, length) -> hits.add(start + ":" + length));

    assertEquals(new TreeSet<>(List.of("1:3", "2:2", "2:4")), new TreeSet<>(hits));
    assertEquals(4, automaton.patternCount());
    assertEquals(4, automaton.maxPatternLength());
  }

  @Test
  void onlyReportsStartsInsideRange() {
    ByteAutomaton automaton = ByteAutomaton.build(List.of(key("aa")));
    DumpBuffer buffer = DumpBuffer.wrap("aaaaaa".getBytes(StandardCharsets.US_ASCII));

    List<Integer> starts = new ArrayList<>();
    automaton.search(buffer, 2, 4, 5, (start, length) -> starts.add(start));

    assertEquals(List.of(2, 3), starts);
  }

  @Test
  void duplicatePatternsCountOnce() {
    ByteAutomaton automaton = ByteAutomaton.build(List.of(key("abc"), key("abc")));

    assertEquals(1, automaton.patternCount());
  }

  @Test
  void agreesWithBruteForceOnRandomBytes() {
    Random random = new Random(42);
    byte[] data = new byte[5_000];
    for (int i = 0; i < data.length; i++) {
      data[i] = (byte) random.nextInt(4);
    }
    DumpBuffer buffer = DumpBuffer.wrap(data);
    List<ByteKey> patterns = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      int length = 1 + random.nextInt(6);
      int offset = random.nextInt(data.length - length);
      patterns.add(ByteKey.of(buffer, offset, length));
    }
    ByteAutomaton automaton = ByteAutomaton.build(patterns);

    TreeSet<String> expected = new TreeSet<>();
    for (ByteKey pattern : new HashSet<>(patterns)) {
      for (int offset = 0; offset + pattern.length() <= data.length; offset++) {
        if (pattern.matchesAt(buffer, offset)) {
          expected.add(offset + ":" + pattern.length());
        }
      }
    }
    TreeSet<String> actual = new TreeSet<>();
    automaton.search(buffer, 0, data.length, data.length, (start, length) -> actual.add(start + ":" + length));

    assertEquals(expected, actual);
  }

  private static ByteKey key(String text) {
    return ByteKey.of(text.getBytes(StandardCharsets.US_ASCII));
  }
}
