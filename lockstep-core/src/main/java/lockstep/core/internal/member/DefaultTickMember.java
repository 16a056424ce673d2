package lockstep.core.internal.member;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.MustBeClosed;
import com.google.errorprone.annotations.ThreadSafe;
import dev.failsafe.Failsafe;
import dev.failsafe.FailsafeException;
import dev.failsafe.RetryPolicy;
import lockstep.api.LockstepException;
import lockstep.api.ManagerShutdownException;
import lockstep.api.MemberRegistrationException;
import lockstep.api.MemberState;
import lockstep.api.SpeedFactors;
import lockstep.api.TickManagerHandle;
import lockstep.api.TickMember;
import lockstep.api.command.TickCommand;
import lockstep.api.command.TickReply;
import lockstep.core.internal.ThreadUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The default {@link TickMember}, a proxy that talks to the coordination loop through a {@link
 * TickManagerHandle}.
 *
 * <h3>Registration</h3>
 *
 * <p>The constructor sends {@code Register} together with a fresh {@link SingleSlotReplyChannel}
 * and blocks for at most one reply timeout for the assigned id. Without an id the member cannot
 * exist, so a timeout, an unexpected reply or a terminated manager fails construction with a {@link
 * MemberRegistrationException}. The reply channel is closed in that case, which makes the loop drop
 * a registration that completes too late.
 *
 * <h3>Waiting for a tick</h3>
 *
 * <p>{@link #waitForTick()} first discards any tick still pending from an earlier step, declares
 * the member {@code FINISHED} and then receives from the reply channel, one reply timeout per attempt. A Failsafe retry policy repeats the receive for as
 * long as it yields nothing or something other than a tick, so the caller never observes a timeout.
 * The retry is aborted when the manager has terminated or the thread is interrupted.
 *
 * <p><b>Resource Management:</b> closing the member unregisters it. A member that is never closed
 * stays registered and, being {@code RUNNING} after its last tick, holds the gate shut for every
 * step it is due on.
 */
@ThreadSafe
public class DefaultTickMember implements TickMember {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultTickMember.class);

  private final TickManagerHandle handle;
  private final int speedFactor;
  private final Duration replyTimeout;
  private final SingleSlotReplyChannel replies = new SingleSlotReplyChannel();
  private final RetryPolicy<TickReply> untilTick;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final long id;

  /**
   * Registers a new member and waits for its id.
   *
   * @param handle the handle of the manager to join
   * @param speedFactor the member takes part in every {@code speedFactor}-th step; values below 1
   *     are treated as 1
   * @param replyTimeout how long to wait for each reply
   * @throws MemberRegistrationException if no id was received
   */
  @MustBeClosed
  public DefaultTickMember(TickManagerHandle handle, int speedFactor, Duration replyTimeout) {
    this.handle = checkNotNull(handle, "handle");
    this.speedFactor = SpeedFactors.normalize(speedFactor);
    this.replyTimeout = checkNotNull(replyTimeout, "replyTimeout");

    try {
      handle.send(new TickCommand.Register(this.speedFactor, replies));
    } catch (LockstepException e) {
      replies.close();
      throw new MemberRegistrationException("Failed to send registration to the tick manager", e);
    }
    this.id = awaitSelfId();

    this.untilTick =
        RetryPolicy.<TickReply>builder()
            .handleResultIf(reply -> !(reply instanceof TickReply.Tick))
            .abortOn(InterruptedException.class, ManagerShutdownException.class)
            .withMaxRetries(-1)
            .onRetry(event -> LOGGER.trace("Member {} retrying tick receive", id))
            .build();

    LOGGER.debug(
        "Member {} joined with speed factor {} from {}",
        id,
        this.speedFactor,
        ThreadUtils.getCurrentThreadId());
  }

  private long awaitSelfId() {
    TickReply reply;
    try {
      reply = replies.poll(replyTimeout);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      replies.close();
      throw new MemberRegistrationException("Interrupted while waiting for a member id", e);
    }
    if (reply instanceof TickReply.SelfId selfId) {
      return selfId.memberId();
    }
    replies.close();
    if (reply == null && handle.isShutdown()) {
      throw new MemberRegistrationException("The tick manager has terminated");
    }
    if (reply == null) {
      throw new MemberRegistrationException("Did not receive a member id within " + replyTimeout);
    }
    throw new MemberRegistrationException("Expected a member id, got " + reply);
  }

  @Override
  public long getId() {
    return id;
  }

  @Override
  public int getSpeedFactor() {
    return speedFactor;
  }

  @Override
  @CanIgnoreReturnValue
  public long waitForTick() throws InterruptedException {
    checkState(!closed.get(), "Member %s is closed", id);
    // A tick left over from an earlier step (received while HIDDEN, or after an interrupted
    // wait) must not release this call.
    replies.clear();
    handle.send(new TickCommand.ChangeMemberState(id, MemberState.FINISHED));
    try {
      TickReply.Tick tick = (TickReply.Tick) Failsafe.with(untilTick).get(this::receive);
      return tick.step();
    } catch (FailsafeException e) {
      if (e.getCause() instanceof InterruptedException interrupted) {
        // Failsafe re-asserts the interrupt flag; the thrown exception carries it instead.
        Thread.interrupted();
        throw interrupted;
      }
      throw new LockstepException(
          "Member " + id + " failed while waiting for a tick", e.getCause());
    }
  }

  private TickReply receive() throws InterruptedException {
    TickReply reply = replies.poll(replyTimeout);
    if (reply == null && handle.isShutdown()) {
      throw new ManagerShutdownException(
          "Tick manager terminated while member " + id + " was waiting for a tick");
    }
    return reply;
  }

  @Override
  public void setState(MemberState state) {
    checkNotNull(state, "state");
    try {
      handle.send(new TickCommand.ChangeMemberState(id, state));
    } catch (ManagerShutdownException e) {
      LOGGER.debug("Ignoring state {} for member {}, the tick manager is gone", state, id);
    }
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    try {
      handle.send(new TickCommand.Unregister(id));
    } catch (LockstepException e) {
      LOGGER.debug("Could not unregister member {}: {}", id, e.getMessage());
    } finally {
      replies.close();
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("speedFactor", speedFactor)
        .add("closed", closed.get())
        .toString();
  }
}
