package lockstep.api;

import com.google.errorprone.annotations.MustBeClosed;
import com.google.errorprone.annotations.ThreadSafe;
import lockstep.api.command.ReplyChannel;
import lockstep.api.command.TickCommand;

/**
 * A shareable capability to submit commands to one tick manager. Handles are cheap, thread-safe
 * and may be passed to any number of client threads.
 */
@ThreadSafe
public interface TickManagerHandle {

  /**
   * Queues a command for the coordination loop. Blocks while the command queue is full.
   *
   * @throws ManagerShutdownException if the loop has terminated
   * @throws LockstepException if the caller is interrupted while the queue is full
   */
  void send(TickCommand command);

  /**
   * @return true once the coordination loop has terminated
   */
  boolean isShutdown();

  /**
   * Registers a new member with the given speed factor and waits for its id.
   *
   * @throws MemberRegistrationException if no id was received in time
   */
  @MustBeClosed
  TickMember newMember(int speedFactor);

  default void register(int speedFactor, ReplyChannel replyChannel) {
    send(new TickCommand.Register(speedFactor, replyChannel));
  }

  default void unregister(long memberId) {
    send(new TickCommand.Unregister(memberId));
  }

  default void changeMemberState(long memberId, MemberState state) {
    send(new TickCommand.ChangeMemberState(memberId, state));
  }

  default void shutdown() {
    send(TickCommand.SHUTDOWN);
  }
}
