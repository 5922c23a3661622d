package az.zeynalov.tests;

import static org.junit.jupiter.api.Assertions.*;

import az.zeynalov.skiplist.HeightCap;
import org.junit.jupiter.api.Test;

class HeightCapTest {

  @Test
  void smallListsGetFlatCap() {
    for (int size = 0; size < 16; size++) {
      assertEquals(13, HeightCap.forSize(size));
    }
  }

  @Test
  void capJumpsAtSixteen() {
    // 3 * ceil(log2(17)) + 1
    assertEquals(16, HeightCap.forSize(16));
  }

  @Test
  void capFollowsCeilingOfLog() {
    assertEquals(16, HeightCap.forSize(31));
    assertEquals(19, HeightCap.forSize(32));
    assertEquals(31, HeightCap.forSize(1023));
    assertEquals(34, HeightCap.forSize(1024));
  }

  @Test
  void capNeverDecreasesAsListGrows() {
    int previous = HeightCap.forSize(0);
    for (int size = 1; size < 5000; size++) {
      int cap = HeightCap.forSize(size);
      assertTrue(cap >= previous);
      previous = cap;
    }
  }
}
