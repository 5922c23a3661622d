package az.zeynalov.skiplist;

import java.util.function.ToIntFunction;

/**
 * Decides whether a key that already occupies layer {@code previousFlips} is also copied into the
 * layer above. Implementations must be pure: the same key and flip index always give the same
 * answer.
 *
 * @param <K> the key type
 */
@FunctionalInterface
public interface PromotionOracle<K> {

  boolean flipCoin(K key, int previousFlips);

  static PromotionOracle<Integer> integers() {
    return (key, previousFlips) -> CoinFlip.flipCoin(key, previousFlips);
  }

  static PromotionOracle<String> strings() {
    return (key, previousFlips) -> CoinFlip.flipCoin(key, previousFlips);
  }

  /**
   * Oracle for arbitrary keys, given a function that folds a key into one byte. Only the low 8
   * bits of the folded value are consulted.
   */
  static <K> PromotionOracle<K> folding(ToIntFunction<? super K> folder) {
    return (key, previousFlips) -> CoinFlip.isHeads(folder.applyAsInt(key), previousFlips);
  }
}
