package az.zeynalov.skiplist.exception;


public class ArenaCapacityException extends RuntimeException {

  private ArenaCapacityException(String message) {
    super(message);
  }

  public static ArenaCapacityException of(int requested, int available) {
    return new ArenaCapacityException(String.format(ErrorMessage.ARENA_IS_FULL, requested, available));
  }
}
