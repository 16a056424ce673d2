package lockstep.api;

/** The tick manager's coordination loop has terminated and can no longer serve the caller. */
public class ManagerShutdownException extends LockstepException {

  public ManagerShutdownException(String message) {
    super(message);
  }
}
