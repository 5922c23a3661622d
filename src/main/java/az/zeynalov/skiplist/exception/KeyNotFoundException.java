package az.zeynalov.skiplist.exception;

/**
 * Thrown by the ordered queries when the requested key was never inserted.
 */
public class KeyNotFoundException extends RuntimeException {

  private KeyNotFoundException(String message) {
    super(message);
  }

  public static KeyNotFoundException of(Object key) {
    return new KeyNotFoundException(String.format(ErrorMessage.KEY_NOT_FOUND, key));
  }
}
