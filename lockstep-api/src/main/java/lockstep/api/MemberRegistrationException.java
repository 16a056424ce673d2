package lockstep.api;

/**
 * Thrown when a {@link TickMember} could not obtain its id from the tick manager. A member without
 * an id cannot exist, so construction is aborted.
 */
public class MemberRegistrationException extends LockstepException {

  public MemberRegistrationException(String message) {
    super(message);
  }

  public MemberRegistrationException(String message, Throwable cause) {
    super(message, cause);
  }
}
