package az.zeynalov.skiplist;

/**
 * Outcome of a descent through the grid. When {@code found} is set, {@code node} is the base-layer
 * node holding the key. Otherwise it is the base-layer node after which the key would be
 * spliced, which is the base head sentinel for a key smaller than every stored key.
 */
public record SearchResult(boolean found, int node) {

  public static SearchResult found(int node) {
    return new SearchResult(true, node);
  }

  public static SearchResult notFound(int predecessor) {
    return new SearchResult(false, predecessor);
  }
}
