package lockstep.api.command;

import static com.google.common.base.Preconditions.checkNotNull;

import lockstep.api.MemberState;
import lockstep.api.SpeedFactors;

/**
 * Commands accepted by the coordination loop of a tick manager. They are queued by any number of
 * client threads and consumed in arrival order by the loop alone.
 */
public sealed interface TickCommand
    permits TickCommand.Register,
        TickCommand.Unregister,
        TickCommand.ChangeMemberState,
        TickCommand.Shutdown {

  Shutdown SHUTDOWN = new Shutdown();

  /**
   * Adds a member. The loop answers with {@link TickReply.SelfId} over {@code replyChannel}, the same
   * channel that later carries the member's ticks.
   */
  record Register(int speedFactor, ReplyChannel replyChannel) implements TickCommand {

    public Register {
      speedFactor = SpeedFactors.normalize(speedFactor);
      checkNotNull(replyChannel, "replyChannel");
    }
  }

  /** Removes a member. A no-op for an unknown id. */
  record Unregister(long memberId) implements TickCommand {}

  /** Records a new state for a member. A no-op for an unknown id. */
  record ChangeMemberState(long memberId, MemberState state) implements TickCommand {

    public ChangeMemberState {
      checkNotNull(state, "state");
    }
  }

  /** Stops the loop. Commands queued behind it are discarded. */
  record Shutdown() implements TickCommand {}
}
