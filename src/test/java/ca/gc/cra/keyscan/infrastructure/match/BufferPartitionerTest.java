package ca.gc.cra.keyscan.infrastructure.match;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class BufferPartitionerTest {

  @Test
  void partitionsCoverEveryOffsetWithoutOverlap() {
    List<BufferPartitioner.Partition> partitions = new BufferPartitioner(3, 10).partition(1_001);

    int expectedStart = 0;
    for (BufferPartitioner.Partition partition : partitions) {
      assertEquals(expectedStart, partition.start());
      assertTrue(partition.length() > 0);
      expectedStart = partition.end();
    }
    assertEquals(1_001, expectedStart);
    assertTrue(partitions.size() >= 3);
  }

  @Test
  void smallBuffersStayInOnePartition() {
    List<BufferPartitioner.Partition> partitions = new BufferPartitioner(8).partition(4_096);

    assertEquals(List.of(new BufferPartitioner.Partition(0, 4_096)), partitions);
  }

  @Test
  void emptyBufferHasNoPartitions() {
    assertTrue(new BufferPartitioner(2, 1).partition(0).isEmpty());
  }

  @Test
  void readLimitExtendsByLongestKeyAndStopsAtBufferEnd() {
    BufferPartitioner.Partition partition = new BufferPartitioner.Partition(10, 20);

    assertEquals(27, partition.readLimit(100, 8));
    assertEquals(22, partition.readLimit(22, 8));
    assertEquals(20, partition.readLimit(100, 1));
  }
}
