package lockstep.api;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;

/**
 * A participant of a tick manager. Each member owns one id for its whole life and is released by
 * the manager once per due step, together with every other member due on that step.
 *
 * <pre>{@code
 * try (TickMember member = manager.handle().newMember(2)) {
 *   while (running) {
 *     simulateHalfRateWork();
 *     member.waitForTick();
 *   }
 * }
 * }</pre>
 *
 * <p>Closing the member unregisters it; a member that is not closed keeps holding the gate shut
 * whenever it is due and still {@link MemberState#RUNNING}.
 */
@ThreadSafe
public interface TickMember extends AutoCloseable {

  /**
   * @return the id assigned by the manager, unique among all members the manager has ever had
   */
  long getId();

  /**
   * @return the normalized speed factor this member registered with
   */
  int getSpeedFactor();

  /**
   * Declares this member {@link MemberState#FINISHED} and blocks until the manager delivers the
   * next tick to it.
   *
   * <p>Timeouts of the underlying receive are retried; the caller only ever sees a tick, an
   * interruption or a terminated manager.
   *
   * @return the number of the step that released this member
   * @throws InterruptedException if the calling thread is interrupted while waiting
   * @throws ManagerShutdownException if the manager terminated before a tick arrived
   */
  @CanIgnoreReturnValue
  long waitForTick() throws InterruptedException;

  /**
   * Records a new state for this member. Fire-and-forget; silently ignored once the manager is gone.
   */
  void setState(MemberState state);

  /** Unregisters this member. Never fails, and does nothing when called again. */
  @Override
  void close();
}
