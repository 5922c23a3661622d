package az.zeynalov.skiplist.exception;

/**
 * Thrown when a key exists but is the extremal key in the requested direction.
 */
public class NoSuchNeighborException extends RuntimeException {

  private NoSuchNeighborException(String message) {
    super(message);
  }

  public static NoSuchNeighborException noNext(Object key) {
    return new NoSuchNeighborException(String.format(ErrorMessage.NO_NEXT_KEY, key));
  }

  public static NoSuchNeighborException noPrevious(Object key) {
    return new NoSuchNeighborException(String.format(ErrorMessage.NO_PREVIOUS_KEY, key));
  }
}
