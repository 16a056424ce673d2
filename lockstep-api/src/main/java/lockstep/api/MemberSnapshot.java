package lockstep.api;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A point-in-time copy of one registered member as held by the coordination loop.
 *
 * @param id the member id
 * @param speedFactor the normalized speed factor
 * @param state the state last recorded for the member
 * @param lastTickNanos monotonic timestamp of the last tick delivered, or of registration
 * @param ticksDelivered the number of steps that released the member
 */
public record MemberSnapshot(
    long id, int speedFactor, MemberState state, long lastTickNanos, long ticksDelivered) {

  public MemberSnapshot {
    checkNotNull(state, "state");
  }
}
