package ca.gc.cra.keyscan.application.pipeline;

import ca.gc.cra.keyscan.domain.scan.ByteKey;
import ca.gc.cra.keyscan.domain.scan.CompositeCandidate;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Lookup from the byte encodings of every composite {@code P * Q} to the pairs producing them.
 * <p><strong>Why:</strong> Matchers confirm a candidate offset with one hash lookup instead of comparing against
 * every pair.</p>
 * <p><strong>Role:</strong> Built by {@link CompositeIndexBuilder}; shared read-only by all matcher strategies.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 * <p><strong>Performance:</strong> Holds two keys per pair; memory grows with the square of the prime count.</p>
 *
 * @implNote A key may resolve to more than one pair because the LSF encoding of one product can equal the MSF
 *     encoding of another.
 * @since 0.1.0
 */
public final class CompositeIndex {
  private final Map<ByteKey, List<CompositeCandidate>> byKey;
  private final List<CompositeCandidate> candidates;
  private final int[] keyLengths;
  private final long rejectedKeys;

  private CompositeIndex(
      Map<ByteKey, List<CompositeCandidate>> byKey,
      List<CompositeCandidate> candidates,
      int[] keyLengths,
      long rejectedKeys) {
    this.byKey = byKey;
    this.candidates = candidates;
    this.keyLengths = keyLengths;
    this.rejectedKeys = rejectedKeys;
  }

  /**
   * Indexes both encodings of every candidate.
   *
   * @param candidates composite pairs
   * @param rejectedKeys number of pairs left out because their encoding was too wide
   * @return immutable index
   */
  public static CompositeIndex of(Collection<CompositeCandidate> candidates, long rejectedKeys) {
    Map<ByteKey, List<CompositeCandidate>> map = new HashMap<>();
    TreeSet<Integer> lengths = new TreeSet<>();
    for (CompositeCandidate candidate : candidates) {
      put(map, candidate.lsf(), candidate);
      if (!candidate.msf().equals(candidate.lsf())) {
        put(map, candidate.msf(), candidate);
      }
      lengths.add(candidate.lsf().length());
    }
    Map<ByteKey, List<CompositeCandidate>> frozen = new HashMap<>(map.size() * 2);
    map.forEach((key, list) -> frozen.put(key, List.copyOf(list)));
    int[] keyLengths = lengths.stream().mapToInt(Integer::intValue).toArray();
    return new CompositeIndex(Map.copyOf(frozen), List.copyOf(candidates), keyLengths, rejectedKeys);
  }

  private static void put(
      Map<ByteKey, List<CompositeCandidate>> map, ByteKey key, CompositeCandidate candidate) {
    map.computeIfAbsent(key, k -> new ArrayList<>(1)).add(candidate);
  }

  /**
   * Returns the pairs whose encoding equals {@code key}.
   *
   * @param key encoded product
   * @return matching pairs; empty when absent
   */
  public List<CompositeCandidate> lookup(ByteKey key) {
    return byKey.getOrDefault(key, List.of());
  }

  /**
   * Returns the pairs whose encoding equals the dump bytes {@code [offset, offset + length)}.
   *
   * @param buffer dump
   * @param offset first byte
   * @param length number of bytes
   * @return matching pairs; empty when absent or when the range does not fit the dump
   */
  public List<CompositeCandidate> lookup(DumpBuffer buffer, int offset, int length) {
    if (offset < 0 || length <= 0 || offset > buffer.length() - length) {
      return List.of();
    }
    return lookup(ByteKey.of(buffer, offset, length));
  }

  /**
   * Returns every indexed key.
   *
   * @return immutable key set
   */
  public Set<ByteKey> keys() {
    return byKey.keySet();
  }

  /**
   * Returns the indexed pairs.
   *
   * @return immutable list in construction order
   */
  public List<CompositeCandidate> candidates() {
    return candidates;
  }

  /**
   * Returns the distinct key lengths in ascending order.
   *
   * @return copy of the key lengths
   */
  public int[] keyLengths() {
    return Arrays.copyOf(keyLengths, keyLengths.length);
  }

  /**
   * Returns the shortest key length.
   *
   * @return length in bytes, or {@code 0} when empty
   */
  public int minKeyLength() {
    return keyLengths.length == 0 ? 0 : keyLengths[0];
  }

  /**
   * Returns the longest key length.
   *
   * @return length in bytes, or {@code 0} when empty
   */
  public int maxKeyLength() {
    return keyLengths.length == 0 ? 0 : keyLengths[keyLengths.length - 1];
  }

  /**
   * Returns the number of indexed pairs.
   *
   * @return pair count
   */
  public int pairCount() {
    return candidates.size();
  }

  /**
   * Returns the number of distinct keys.
   *
   * @return key count
   */
  public int keyCount() {
    return byKey.size();
  }

  /**
   * Returns the number of pairs left out because their encoding exceeded the allowed width.
   *
   * @return rejected pair count
   */
  public long rejectedKeys() {
    return rejectedKeys;
  }

  /**
   * Indicates whether the index holds no keys.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return byKey.isEmpty();
  }

  @Override
  public String toString() {
    return "CompositeIndex{pairs=" + candidates.size() + ", keys=" + byKey.size()
        + ", keyLengths=" + Arrays.toString(keyLengths) + '}';
  }
}
