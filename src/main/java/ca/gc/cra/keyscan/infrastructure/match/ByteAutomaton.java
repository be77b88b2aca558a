package ca.gc.cra.keyscan.infrastructure.match;

import ca.gc.cra.keyscan.domain.scan.ByteKey;
import ca.gc.cra.keyscan.domain.scan.DumpBuffer;
import java.util.Arrays;
import java.util.Collection;

/**
 * Aho-Corasick automaton over byte patterns.
 *
 * <p>Search is linear in the scanned range regardless of pattern count: every byte is consumed once and failure
 * links replace backtracking. Children are stored as singly linked edge lists in parallel arrays so that memory
 * grows with total pattern length instead of {@code 256 * states}; the root alone keeps a dense table because
 * almost every scanned byte passes through it.</p>
 *
 * <p>Instances are immutable once built and safe to share between threads.</p>
 *
 * @since 0.1.0
 */
final class ByteAutomaton {
  private static final int ROOT = 0;
  private static final int NONE = -1;

  private final int[] rootNext;
  private final int[] firstEdge;
  private final int[] fail;
  private final int[] dictLink;
  private final int[] depth;
  private final boolean[] terminal;
  private final byte[] edgeLabel;
  private final int[] edgeTarget;
  private final int[] edgeNext;
  private final int patternCount;
  private final int maxPatternLength;

  private ByteAutomaton(Builder builder, int[] fail, int[] dictLink) {
    this.rootNext = builder.rootNext;
    this.firstEdge = Arrays.copyOf(builder.firstEdge, builder.nodes);
    this.depth = Arrays.copyOf(builder.depth, builder.nodes);
    this.terminal = Arrays.copyOf(builder.terminal, builder.nodes);
    this.edgeLabel = Arrays.copyOf(builder.edgeLabel, builder.edges);
    this.edgeTarget = Arrays.copyOf(builder.edgeTarget, builder.edges);
    this.edgeNext = Arrays.copyOf(builder.edgeNext, builder.edges);
    this.fail = fail;
    this.dictLink = dictLink;
    this.patternCount = builder.patterns;
    this.maxPatternLength = builder.maxLength;
  }

  /**
   * Builds an automaton recognizing every key.
   *
   * @param patterns non-empty keys; duplicates are ignored
   * @return immutable automaton
   */
  static ByteAutomaton build(Collection<ByteKey> patterns) {
    Builder builder = new Builder();
    for (ByteKey pattern : patterns) {
      builder.add(pattern);
    }
    return builder.link();
  }

  int stateCount() {
    return depth.length;
  }

  int patternCount() {
    return patternCount;
  }

  int maxPatternLength() {
    return maxPatternLength;
  }

  /**
   * Reports every pattern occurrence whose start offset lies in {@code [from, to)}.
   *
   * @param buffer dump to scan
   * @param from first start offset to report
   * @param to one past the last start offset to report
   * @param limit exclusive offset up to which bytes may be read
   * @param listener receives {@code (start, length)} of each occurrence
   */
  void search(DumpBuffer buffer, int from, int to, int limit, MatchListener listener) {
    int state = ROOT;
    for (int pos = from; pos < limit; pos++) {
      state = step(state, buffer.unsignedAt(pos));
      for (int out = terminal[state] ? state : dictLink[state]; out != NONE; out = dictLink[out]) {
        int start = pos - depth[out] + 1;
        if (start < to) {
          listener.onMatch(start, depth[out]);
        }
      }
      // no pattern starting before 'to' can end at or after this point
      if (pos - to + 1 >= maxPatternLength) {
        break;
      }
    }
  }

  private int step(int state, int value) {
    int current = state;
    while (current != ROOT) {
      int next = child(current, value);
      if (next != NONE) {
        return next;
      }
      current = fail[current];
    }
    int next = rootNext[value];
    return next == NONE ? ROOT : next;
  }

  private int child(int node, int value) {
    if (node == ROOT) {
      return rootNext[value];
    }
    for (int edge = firstEdge[node]; edge != NONE; edge = edgeNext[edge]) {
      if ((edgeLabel[edge] & 0xFF) == value) {
        return edgeTarget[edge];
      }
    }
    return NONE;
  }

  /** Receives pattern occurrences. */
  @FunctionalInterface
  interface MatchListener {
    void onMatch(int start, int length);
  }

  private static final class Builder {
    private final int[] rootNext = new int[256];
    private int[] firstEdge = new int[64];
    private int[] depth = new int[64];
    private boolean[] terminal = new boolean[64];
    private byte[] edgeLabel = new byte[64];
    private int[] edgeTarget = new int[64];
    private int[] edgeNext = new int[64];
    private int nodes;
    private int edges;
    private int patterns;
    private int maxLength;

    Builder() {
      Arrays.fill(rootNext, NONE);
      newNode(0);
    }

    void add(ByteKey pattern) {
      if (pattern.length() == 0) {
        throw new IllegalArgumentException("patterns must not be empty");
      }
      int node = ROOT;
      for (int i = 0; i < pattern.length(); i++) {
        int value = pattern.byteAt(i) & 0xFF;
        int next = childOf(node, value);
        if (next == NONE) {
          next = newNode(i + 1);
          attach(node, value, next);
        }
        node = next;
      }
      if (!terminal[node]) {
        terminal[node] = true;
        patterns++;
        maxLength = Math.max(maxLength, pattern.length());
      }
    }

    ByteAutomaton link() {
      int[] fail = new int[nodes];
      int[] dictLink = new int[nodes];
      Arrays.fill(dictLink, NONE);
      int[] queue = new int[nodes];
      int head = 0;
      int tail = 0;
      for (int value = 0; value < 256; value++) {
        int child = rootNext[value];
        if (child != NONE) {
          fail[child] = ROOT;
          queue[tail++] = child;
        }
      }
      while (head < tail) {
        int node = queue[head++];
        for (int edge = firstEdge[node]; edge != NONE; edge = edgeNext[edge]) {
          int value = edgeLabel[edge] & 0xFF;
          int child = edgeTarget[edge];
          int f = fail[node];
          int target = childOf(f, value);
          while (f != ROOT && target == NONE) {
            f = fail[f];
            target = childOf(f, value);
          }
          fail[child] = target == NONE ? ROOT : target;
          int suffix = fail[child];
          dictLink[child] = terminal[suffix] ? suffix : dictLink[suffix];
          queue[tail++] = child;
        }
      }
      return new ByteAutomaton(this, fail, dictLink);
    }

    private int childOf(int node, int value) {
      if (node == ROOT) {
        return rootNext[value];
      }
      for (int edge = firstEdge[node]; edge != NONE; edge = edgeNext[edge]) {
        if ((edgeLabel[edge] & 0xFF) == value) {
          return edgeTarget[edge];
        }
      }
      return NONE;
    }

    private int newNode(int nodeDepth) {
      if (nodes == depth.length) {
        int capacity = Math.multiplyExact(depth.length, 2);
        firstEdge = Arrays.copyOf(firstEdge, capacity);
        depth = Arrays.copyOf(depth, capacity);
        terminal = Arrays.copyOf(terminal, capacity);
      }
      firstEdge[nodes] = NONE;
      depth[nodes] = nodeDepth;
      return nodes++;
    }

    private void attach(int parent, int value, int child) {
      if (parent == ROOT) {
        rootNext[value] = child;
        return;
      }
      if (edges == edgeTarget.length) {
        int capacity = Math.multiplyExact(edgeTarget.length, 2);
        edgeLabel = Arrays.copyOf(edgeLabel, capacity);
        edgeTarget = Arrays.copyOf(edgeTarget, capacity);
        edgeNext = Arrays.copyOf(edgeNext, capacity);
      }
      edgeLabel[edges] = (byte) value;
      edgeTarget[edges] = child;
      edgeNext[edges] = firstEdge[parent];
      firstEdge[parent] = edges;
      edges++;
    }
  }
}
