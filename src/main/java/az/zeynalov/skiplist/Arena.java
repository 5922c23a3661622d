package az.zeynalov.skiplist;

import az.zeynalov.skiplist.exception.ArenaCapacityException;
import az.zeynalov.skiplist.exception.ErrorMessage;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * On-heap node storage for the skip list grid. Every node (sentinel or data) is addressed by an
 * int handle, and links between nodes are handles as well, so there is no object graph of
 * nodes. A link that points nowhere is {@link #NULL}.
 * <p>
 * Layout per handle: [sentinel flag] [key] [value] [height] [next] [prev] [up] [down]
 * <p>
 * Handles are never reused, nodes are never freed individually. The whole grid goes away with
 * the arena.
 */
public class Arena {

  public final static int NULL = -1;
  public final static int DEFAULT_INITIAL_CAPACITY = 64;
  public final static int DEFAULT_MAX_NODES = Integer.MAX_VALUE - 8;

  private static final Logger log = LoggerFactory.getLogger(Arena.class);

  private final int maxNodes;

  private boolean[] sentinel;
  private Object[] keys;
  private Object[] values;
  private int[] heights;
  private int[] next;
  private int[] prev;
  private int[] up;
  private int[] down;

  private int availableHandle;

  public Arena() {
    this(DEFAULT_INITIAL_CAPACITY, DEFAULT_MAX_NODES);
  }

  public Arena(int initialCapacity, int maxNodes) {
    if (initialCapacity <= 0 || maxNodes <= 0 || initialCapacity > maxNodes
        || maxNodes > DEFAULT_MAX_NODES) {
      throw new IllegalArgumentException(ErrorMessage.ARENA_BAD_CAPACITY);
    }
    this.maxNodes = maxNodes;
    this.sentinel = new boolean[initialCapacity];
    this.keys = new Object[initialCapacity];
    this.values = new Object[initialCapacity];
    this.heights = new int[initialCapacity];
    this.next = newLinks(initialCapacity);
    this.prev = newLinks(initialCapacity);
    this.up = newLinks(initialCapacity);
    this.down = newLinks(initialCapacity);
    this.availableHandle = 0;
  }

  /**
   * Makes sure {@code count} more nodes can be allocated without failing. Callers that need
   * several nodes for one logical change reserve them up front, so the change either happens
   * completely or not at all.
   */
  public void ensureCapacity(int count) {
    long required = (long) availableHandle + count;
    if (required > maxNodes) {
      throw ArenaCapacityException.of(count, maxNodes - availableHandle);
    }
    if (required > sentinel.length) {
      grow((int) required);
    }
  }

  public int allocateSentinel() {
    int handle = allocate();
    sentinel[handle] = true;
    return handle;
  }

  public int allocateNode(Object key, Object value) {
    int handle = allocate();
    keys[handle] = key;
    values[handle] = value;
    return handle;
  }

  /**
   * Allocates a promoted copy of a key. Copies above the base layer carry neither a value nor a
   * height.
   */
  public int allocateCopy(Object key) {
    int handle = allocate();
    keys[handle] = key;
    return handle;
  }

  public boolean isNull(int handle) {
    return handle == NULL;
  }

  public boolean isSentinel(int handle) {
    return sentinel[handle];
  }

  public Object readKey(int handle) {
    return keys[handle];
  }

  public Object readValue(int handle) {
    return values[handle];
  }

  public void writeValue(int handle, Object value) {
    values[handle] = value;
  }

  public int readHeight(int handle) {
    return heights[handle];
  }

  public void writeHeight(int handle, int height) {
    heights[handle] = height;
  }

  public int next(int handle) {
    return next[handle];
  }

  public int prev(int handle) {
    return prev[handle];
  }

  public int up(int handle) {
    return up[handle];
  }

  public int down(int handle) {
    return down[handle];
  }

  /**
   * Links two nodes of the same layer, {@code left} directly before {@code right}.
   */
  public void linkHorizontally(int left, int right) {
    next[left] = right;
    prev[right] = left;
  }

  /**
   * Links two nodes of the same column, {@code lower} directly below {@code upper}.
   */
  public void linkVertically(int lower, int upper) {
    up[lower] = upper;
    down[upper] = lower;
  }

  /**
   * Splices {@code node} into a layer right after {@code position}.
   */
  public void spliceAfter(int position, int node) {
    int following = next[position];
    linkHorizontally(node, following);
    linkHorizontally(position, node);
  }

  public int getArenaSize() {
    return availableHandle;
  }

  public int getCapacity() {
    return sentinel.length;
  }

  public int getMaxNodes() {
    return maxNodes;
  }

  private int allocate() {
    ensureCapacity(1);
    return availableHandle++;
  }

  private void grow(int required) {
    int oldCapacity = sentinel.length;
    int newCapacity = (int) Math.min(maxNodes, Math.max((long) oldCapacity << 1, required));

    sentinel = Arrays.copyOf(sentinel, newCapacity);
    keys = Arrays.copyOf(keys, newCapacity);
    values = Arrays.copyOf(values, newCapacity);
    heights = Arrays.copyOf(heights, newCapacity);
    next = copyLinks(next, newCapacity);
    prev = copyLinks(prev, newCapacity);
    up = copyLinks(up, newCapacity);
    down = copyLinks(down, newCapacity);

    log.debug("Arena grown from {} to {} node slots", oldCapacity, newCapacity);
  }

  private static int[] newLinks(int capacity) {
    int[] links = new int[capacity];
    Arrays.fill(links, NULL);
    return links;
  }

  private static int[] copyLinks(int[] links, int capacity) {
    int oldLength = links.length;
    int[] copy = Arrays.copyOf(links, capacity);
    Arrays.fill(copy, oldLength, capacity, NULL);
    return copy;
  }
}
