package az.zeynalov.skiplist.exception;

public class ErrorMessage {

  public final static String ARENA_IS_FULL = "No node slots left in arena! Requested %d, available %d.";
  public final static String ARENA_NOT_EMPTY = "Skip list requires an empty arena!";
  public final static String ARENA_BAD_CAPACITY = "Arena capacity must be positive and not exceed the maximum!";
  public final static String KEY_NOT_FOUND = "Key %s is not present in the skip list!";
  public final static String NO_NEXT_KEY = "Key %s is the largest key, it has no next key!";
  public final static String NO_PREVIOUS_KEY = "Key %s is the smallest key, it has no previous key!";
  public final static String NULL_KEY = "Skip list keys must not be null!";
  public final static String LAYER_OUT_OF_RANGE = "Layer %d is outside of [0, %d)!";

}
