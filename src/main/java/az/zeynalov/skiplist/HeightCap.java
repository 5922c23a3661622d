package az.zeynalov.skiplist;

/**
 * Upper bound on the number of layers an insert may grow the list to. Small lists get a flat
 * allowance, larger ones a bound logarithmic in their size. The jump from 13 to 16 at size 16 is
 * intentional.
 */
public final class HeightCap {

  public final static int SMALL_LIST_SIZE = 16;
  public final static int SMALL_LIST_CAP = 13;

  private HeightCap() {
  }

  /**
   * @param sizeBeforeInsert number of keys in the list before the insert
   * @return the layer count at which promotion stops
   */
  public static int forSize(int sizeBeforeInsert) {
    if (sizeBeforeInsert < SMALL_LIST_SIZE) {
      return SMALL_LIST_CAP;
    }
    return 3 * ceilLog2(sizeBeforeInsert + 1) + 1;
  }

  private static int ceilLog2(int value) {
    return Integer.SIZE - Integer.numberOfLeadingZeros(value - 1);
  }
}
