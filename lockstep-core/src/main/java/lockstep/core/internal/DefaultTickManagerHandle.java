package lockstep.core.internal;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.MustBeClosed;
import com.google.errorprone.annotations.ThreadSafe;
import lockstep.api.LockstepException;
import lockstep.api.ManagerShutdownException;
import lockstep.api.TickManagerHandle;
import lockstep.api.TickMember;
import lockstep.api.command.TickCommand;
import lockstep.core.internal.member.DefaultTickMember;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The producer side of a manager's bounded command queue. While the queue is full, {@link #send}
 * keeps retrying and checks between attempts whether the loop is still alive, so a producer never
 * waits forever on a manager that is gone.
 */
@ThreadSafe
final class DefaultTickManagerHandle implements TickManagerHandle {

  private static final long OFFER_RETRY_MILLIS = 50;

  private final BlockingQueue<TickCommand> commands;
  private final AtomicBoolean terminated;
  private final Duration replyTimeout;

  DefaultTickManagerHandle(
      BlockingQueue<TickCommand> commands, AtomicBoolean terminated, Duration replyTimeout) {
    this.commands = commands;
    this.terminated = terminated;
    this.replyTimeout = replyTimeout;
  }

  @Override
  public void send(TickCommand command) {
    checkNotNull(command, "command");
    try {
      while (!isShutdown()) {
        if (commands.offer(command, OFFER_RETRY_MILLIS, TimeUnit.MILLISECONDS)) {
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LockstepException("Interrupted while sending " + command, e);
    }
    throw new ManagerShutdownException("The tick manager has terminated, dropped " + command);
  }

  @Override
  public boolean isShutdown() {
    return terminated.get();
  }

  @Override
  @MustBeClosed
  public TickMember newMember(int speedFactor) {
    return new DefaultTickMember(this, speedFactor, replyTimeout);
  }
}
