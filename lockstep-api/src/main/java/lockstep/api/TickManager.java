package lockstep.api;

import java.util.List;
import java.util.Optional;

/**
 * Owns a coordination loop running on a dedicated thread. The loop starts a new step at the
 * configured {@link Cadence}, but only once every member due on that step is ready, and then
 * releases exactly those members.
 *
 * <p>Closing the manager stops the loop and waits for its thread to finish. Members still
 * registered at that point observe a {@link ManagerShutdownException} from blocking calls.
 */
public interface TickManager extends AutoCloseable {

  /**
   * @return the handle client threads use to create members and send commands
   */
  TickManagerHandle handle();

  Cadence cadence();

  /**
   * @return the number of the last accepted step, read as unsigned; 0 before the first step
   */
  long currentStep();

  /**
   * @return snapshots of all registered members, ordered by id
   */
  List<MemberSnapshot> members();

  Optional<MemberSnapshot> member(long memberId);

  /**
   * @return true until the coordination loop has terminated
   */
  boolean isRunning();

  /** Sends {@code Shutdown} and blocks until the loop thread has terminated. Idempotent. */
  @Override
  void close();
}
