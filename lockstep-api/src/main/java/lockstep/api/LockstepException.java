package lockstep.api;

public class LockstepException extends RuntimeException {

  public LockstepException(Throwable cause) {
    super(cause);
  }

  public LockstepException(String message) {
    super(message);
  }

  public LockstepException(String message, Throwable cause) {
    super(message, cause);
  }
}
