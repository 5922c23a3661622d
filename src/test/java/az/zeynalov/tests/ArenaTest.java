package az.zeynalov.tests;

import static org.junit.jupiter.api.Assertions.*;

import az.zeynalov.skiplist.Arena;
import az.zeynalov.skiplist.exception.ArenaCapacityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class ArenaTest {

  private Arena arena;

  @BeforeEach
  public void setup() {
    arena = new Arena(4, 16);
  }

  @Nested
  class Allocation {

    @Test
    void firstAllocationReturnsZeroHandle() {
      int handle = arena.allocateSentinel();
      assertEquals(0, handle);
    }

    @Test
    void consecutiveAllocationsReturnIncrementingHandles() {
      int first = arena.allocateSentinel();
      int second = arena.allocateNode(1, "one");
      int third = arena.allocateCopy(1);

      assertEquals(0, first);
      assertEquals(1, second);
      assertEquals(2, third);
      assertEquals(3, arena.getArenaSize());
    }

    @Test
    void sizeIsZeroBeforeAnyAllocation() {
      assertEquals(0, arena.getArenaSize());
    }

    @Test
    void allocationGrowsPastInitialCapacity() {
      for (int i = 0; i < 10; i++) {
        arena.allocateNode(i, i);
      }
      assertEquals(10, arena.getArenaSize());
      assertTrue(arena.getCapacity() >= 10);
      assertEquals(7, arena.readKey(7));
    }

    @Test
    void allocationExactlyAtMaxSucceeds() {
      for (int i = 0; i < 16; i++) {
        arena.allocateSentinel();
      }
      assertEquals(16, arena.getArenaSize());
      assertEquals(16, arena.getCapacity());
      assertEquals(arena.getMaxNodes(), arena.getCapacity());
    }

    @Test
    void allocationOneOverMaxThrows() {
      for (int i = 0; i < 16; i++) {
        arena.allocateSentinel();
      }
      assertThrows(ArenaCapacityException.class, () -> arena.allocateSentinel());
    }

    @Test
    void ensureCapacityBeyondMaxThrowsWithoutAllocating() {
      arena.allocateSentinel();
      assertThrows(ArenaCapacityException.class, () -> arena.ensureCapacity(16));
      assertEquals(1, arena.getArenaSize());
      assertDoesNotThrow(() -> arena.ensureCapacity(15));
    }

    @Test
    void invalidCapacitiesAreRejected() {
      assertThrows(IllegalArgumentException.class, () -> new Arena(0, 10));
      assertThrows(IllegalArgumentException.class, () -> new Arena(10, 5));
      assertThrows(IllegalArgumentException.class, () -> new Arena(1, -1));
    }
  }

  @Nested
  class Nodes {

    @Test
    void sentinelCarriesNoKey() {
      int handle = arena.allocateSentinel();
      assertTrue(arena.isSentinel(handle));
      assertNull(arena.readKey(handle));
      assertNull(arena.readValue(handle));
    }

    @Test
    void dataNodeKeepsKeyAndValue() {
      int handle = arena.allocateNode("key", "value");
      assertFalse(arena.isSentinel(handle));
      assertEquals("key", arena.readKey(handle));
      assertEquals("value", arena.readValue(handle));
      assertEquals(0, arena.readHeight(handle));
    }

    @Test
    void copyCarriesKeyOnly() {
      int handle = arena.allocateCopy("key");
      assertEquals("key", arena.readKey(handle));
      assertNull(arena.readValue(handle));
    }

    @Test
    void writesAreVisible() {
      int handle = arena.allocateNode("key", "old");
      arena.writeValue(handle, "new");
      arena.writeHeight(handle, 3);
      assertEquals("new", arena.readValue(handle));
      assertEquals(3, arena.readHeight(handle));
    }
  }

  @Nested
  class Links {

    @Test
    void freshNodeHasNoNeighbours() {
      int handle = arena.allocateNode(1, 1);
      assertTrue(arena.isNull(arena.next(handle)));
      assertTrue(arena.isNull(arena.prev(handle)));
      assertTrue(arena.isNull(arena.up(handle)));
      assertTrue(arena.isNull(arena.down(handle)));
    }

    @Test
    void nodesAllocatedAfterGrowthHaveNoNeighbours() {
      for (int i = 0; i < 4; i++) {
        arena.allocateSentinel();
      }
      int handle = arena.allocateNode(1, 1);
      assertEquals(Arena.NULL, arena.next(handle));
      assertEquals(Arena.NULL, arena.down(handle));
    }

    @Test
    void spliceAfterInsertsBetweenNeighbours() {
      int head = arena.allocateSentinel();
      int tail = arena.allocateSentinel();
      arena.linkHorizontally(head, tail);

      int node = arena.allocateNode(1, 1);
      arena.spliceAfter(head, node);

      assertEquals(node, arena.next(head));
      assertEquals(head, arena.prev(node));
      assertEquals(tail, arena.next(node));
      assertEquals(node, arena.prev(tail));
    }

    @Test
    void verticalLinksSurviveGrowth() {
      int lower = arena.allocateNode(1, 1);
      int upper = arena.allocateCopy(1);
      arena.linkVertically(lower, upper);

      for (int i = 0; i < 10; i++) {
        arena.allocateSentinel();
      }

      assertEquals(upper, arena.up(lower));
      assertEquals(lower, arena.down(upper));
    }
  }
}
