package az.zeynalov.skiplist;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic coin used to decide promotions. A key is folded into a single byte by XOR-ing
 * its bytes, and flip number {@code i} reads bit {@code i % 8} of that byte.
 * <p>
 * Key 0 folds to 00000000 and never leaves the base layer. Key 5 folds to 00000101, so flip 0
 * is heads (5 is copied into layer 1) and flip 1 is tails (it stops there). Key 255 folds to
 * 11111111 and is heads forever, only the height cap stops it.
 */
public final class CoinFlip {

  private CoinFlip() {
  }

  /**
   * XOR of the four bytes of the 32-bit two's complement form.
   */
  public static int fold(int key) {
    int first8Bits = (key >>> 24) & 0xFF;
    int next8Bits = (key >>> 16) & 0xFF;
    int andThen = (key >>> 8) & 0xFF;
    int lastBits = key & 0xFF;
    return first8Bits ^ next8Bits ^ andThen ^ lastBits;
  }

  /**
   * XOR of all bytes, 0 for an empty array.
   */
  public static int fold(byte[] key) {
    int folded = 0;
    for (byte b : key) {
      folded ^= b & 0xFF;
    }
    return folded;
  }

  /**
   * XOR of the UTF-8 bytes of the string. For ASCII this is the XOR of its characters.
   */
  public static int fold(String key) {
    return fold(key.getBytes(StandardCharsets.UTF_8));
  }

  public static boolean isHeads(int folded, int previousFlips) {
    return (folded & (1 << (previousFlips & 7))) != 0;
  }

  public static boolean flipCoin(int key, int previousFlips) {
    return isHeads(fold(key), previousFlips);
  }

  public static boolean flipCoin(String key, int previousFlips) {
    return isHeads(fold(key), previousFlips);
  }
}
