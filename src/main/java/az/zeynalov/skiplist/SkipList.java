package az.zeynalov.skiplist;

import az.zeynalov.skiplist.exception.ErrorMessage;
import az.zeynalov.skiplist.exception.KeyNotFoundException;
import az.zeynalov.skiplist.exception.NoSuchNeighborException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered key/value container laid out as a grid of doubly linked layers. Promotion to higher
 * layers is decided by a {@link PromotionOracle} instead of a random number generator, so the
 * shape of the list only depends on the keys and the order they were inserted in.
 * <p>
 * Structure after inserting 0, 1, 2, 3 with {@link PromotionOracle#integers()}:
 * <pre>
 * S_3: -inf ---------------------> inf
 * S_2: -inf ---------------> 3 --> inf
 * S_1: -inf -------> 1 ----> 3 --> inf
 * S_0: -inf --> 0 -> 1 -> 2 -> 3 --> inf
 * </pre>
 * The top layer is always empty. Keys cannot be removed.
 * <p>
 * Not thread-safe.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class SkipList<K extends Comparable<? super K>, V> {

  private static final Logger log = LoggerFactory.getLogger(SkipList.class);

  private final Arena arena;
  private final PromotionOracle<? super K> oracle;

  private final int bottomHead;
  private final int bottomTail;
  private int topHead;
  private int topTail;

  private int size;
  private int layers;

  public SkipList(PromotionOracle<? super K> oracle) {
    this(new Arena(), oracle);
  }

  public SkipList(Arena arena, PromotionOracle<? super K> oracle) {
    if (arena.getArenaSize() != 0) {
      throw new IllegalArgumentException(ErrorMessage.ARENA_NOT_EMPTY);
    }
    this.arena = arena;
    this.oracle = Objects.requireNonNull(oracle);

    arena.ensureCapacity(4);
    this.bottomHead = arena.allocateSentinel();
    this.bottomTail = arena.allocateSentinel();
    arena.linkHorizontally(bottomHead, bottomTail);
    this.topHead = bottomHead;
    this.topTail = bottomTail;
    this.layers = 1;
    addLayer();

    this.size = 0;
  }

  public static <V> SkipList<Integer, V> forIntegers() {
    return new SkipList<>(PromotionOracle.integers());
  }

  public static <V> SkipList<String, V> forStrings() {
    return new SkipList<>(PromotionOracle.strings());
  }

  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Number of layers including the empty top layer. An empty list has two.
   */
  public int numLayers() {
    return layers;
  }

  /**
   * Descends from the top head sentinel: right while the next key is smaller, down when it is
   * larger or the lane ends. A match on any layer is followed down its column to the base layer.
   */
  public SearchResult search(K key) {
    Objects.requireNonNull(key, ErrorMessage.NULL_KEY);
    int current = topHead;

    while (true) {
      int following = arena.next(current);
      while (!arena.isSentinel(following) && compare(following, key) < 0) {
        current = following;
        following = arena.next(current);
      }

      if (!arena.isSentinel(following) && compare(following, key) == 0) {
        return SearchResult.found(bottomOf(following));
      }

      int below = arena.down(current);
      if (arena.isNull(below)) {
        return SearchResult.notFound(current);
      }
      current = below;
    }
  }

  public boolean contains(K key) {
    return search(key).found();
  }

  /**
   * Inserts the pair unless the key is already present.
   *
   * @return true if the pair was inserted, false if the key already existed
   */
  public boolean insert(K key, V value) {
    SearchResult position = search(key);
    if (position.found()) {
      return false;
    }

    int promotions = countPromotions(key, HeightCap.forSize(size));
    int newLayers = Math.max(0, promotions + 2 - layers);
    arena.ensureCapacity(1 + promotions + 2 * newLayers);

    int node = arena.allocateNode(key, value);
    arena.spliceAfter(position.node(), node);
    arena.writeHeight(node, 1);

    int column = node;
    int current = position.node();
    for (int previousFlips = 0; previousFlips < promotions; previousFlips++) {
      if (previousFlips + 1 >= layers - 1) {
        addLayer();
      }

      while (arena.isNull(arena.up(current))) {
        current = arena.prev(current);
      }
      current = arena.up(current);

      int copy = arena.allocateCopy(key);
      arena.spliceAfter(current, copy);
      arena.linkVertically(column, copy);
      column = copy;

      arena.writeHeight(node, previousFlips + 2);
    }

    size++;
    return true;
  }

  public V find(K key) {
    return readValue(existing(key));
  }

  /**
   * Overwrites the value stored for an existing key.
   *
   * @return the previous value
   */
  public V replace(K key, V value) {
    int node = existing(key);
    V previous = readValue(node);
    arena.writeValue(node, value);
    return previous;
  }

  /**
   * Number of layers the key occupies, counting the base layer as 1.
   */
  public int height(K key) {
    return arena.readHeight(existing(key));
  }

  public K nextKey(K key) {
    int following = arena.next(existing(key));
    if (arena.isSentinel(following)) {
      throw NoSuchNeighborException.noNext(key);
    }
    return readKey(following);
  }

  public K previousKey(K key) {
    int preceding = arena.prev(existing(key));
    if (arena.isSentinel(preceding)) {
      throw NoSuchNeighborException.noPrevious(key);
    }
    return readKey(preceding);
  }

  public boolean isSmallestKey(K key) {
    return arena.isSentinel(arena.prev(existing(key)));
  }

  public boolean isLargestKey(K key) {
    return arena.isSentinel(arena.next(existing(key)));
  }

  /**
   * Snapshot of all keys in increasing order. Later inserts are not reflected in the returned
   * list.
   */
  public List<K> allKeysInOrder() {
    return keysFrom(bottomHead);
  }

  /**
   * Snapshot of the keys on one layer, 0 being the base layer.
   */
  public List<K> keysAtLayer(int layer) {
    if (layer < 0 || layer >= layers) {
      throw new IndexOutOfBoundsException(String.format(ErrorMessage.LAYER_OUT_OF_RANGE, layer, layers));
    }
    int head = bottomHead;
    for (int i = 0; i < layer; i++) {
      head = arena.up(head);
    }
    return keysFrom(head);
  }

  public void forEach(BiConsumer<? super K, ? super V> consumer) {
    int current = arena.next(bottomHead);
    while (current != bottomTail) {
      consumer.accept(readKey(current), readValue(current));
      current = arena.next(current);
    }
  }

  /**
   * Replays the promotion loop without touching the grid: flips while heads and the layer count,
   * including fast lanes the loop would add, stays under the cap.
   */
  private int countPromotions(K key, int cap) {
    int previousFlips = 0;
    int plannedLayers = layers;
    while (oracle.flipCoin(key, previousFlips)) {
      if (plannedLayers >= cap) {
        log.debug("Promotion of key {} halted at {} layers by height cap", key, plannedLayers);
        break;
      }
      if (previousFlips + 1 >= plannedLayers - 1) {
        plannedLayers++;
      }
      previousFlips++;
    }
    return previousFlips;
  }

  /**
   * Puts a new empty layer on top and links its sentinels above the old top sentinels.
   */
  private void addLayer() {
    int head = arena.allocateSentinel();
    int tail = arena.allocateSentinel();
    arena.linkHorizontally(head, tail);
    arena.linkVertically(topHead, head);
    arena.linkVertically(topTail, tail);
    topHead = head;
    topTail = tail;
    layers++;
    log.debug("Added fast lane, skip list now has {} layers", layers);
  }

  private int existing(K key) {
    SearchResult result = search(key);
    if (!result.found()) {
      throw KeyNotFoundException.of(key);
    }
    return result.node();
  }

  private int bottomOf(int node) {
    int current = node;
    while (!arena.isNull(arena.down(current))) {
      current = arena.down(current);
    }
    return current;
  }

  private List<K> keysFrom(int head) {
    List<K> keys = new ArrayList<>();
    int current = arena.next(head);
    while (!arena.isSentinel(current)) {
      keys.add(readKey(current));
      current = arena.next(current);
    }
    return keys;
  }

  private int compare(int node, K key) {
    return readKey(node).compareTo(key);
  }

  @SuppressWarnings("unchecked")
  private K readKey(int node) {
    return (K) arena.readKey(node);
  }

  @SuppressWarnings("unchecked")
  private V readValue(int node) {
    return (V) arena.readValue(node);
  }
}
