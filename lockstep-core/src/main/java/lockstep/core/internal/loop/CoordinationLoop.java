package lockstep.core.internal.loop;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import lockstep.api.Cadence;
import lockstep.api.IdleStrategy;
import lockstep.api.TickManagerOptions;
import lockstep.api.command.ReplyChannel;
import lockstep.api.command.TickCommand;
import lockstep.api.command.TickReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Queue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The single consumer of a tick manager's command queue and the only writer of its {@link
 * MemberRegistry}.
 *
 * <p>Each iteration performs, in order:
 *
 * <ol>
 *   <li><b>Drain:</b> all queued commands are applied in arrival order without blocking. A {@code
 *       Shutdown} ends the loop immediately; commands queued behind it are dropped.
 *   <li><b>Cadence:</b> if less than one period has passed since the last accepted step, the
 *       iteration ends here.
 *   <li><b>Gate:</b> the members due on step {@code current + 1} are computed from their speed
 *       factors. If any of them is still {@code RUNNING} nothing changes and the same step is tried
 *       again on a later iteration. If nobody is due, the step passes without a release.
 *   <li><b>Release:</b> otherwise the step is accepted, the due members are marked as ticked and,
 *       after the registry lock is released, each of them is offered a {@link TickReply.Tick}.
 *       Offers never block and a refused offer is dropped.
 *   <li><b>Idle:</b> the thread gives up the processor as configured by {@link IdleStrategy}.
 * </ol>
 *
 * <p>The step counter is an unsigned 64-bit value that wraps around; due-ness is computed with
 * unsigned arithmetic so the wrap is harmless.
 */
public final class CoordinationLoop implements Runnable {

  private static final Logger LOGGER = LoggerFactory.getLogger(CoordinationLoop.class);

  private final Queue<TickCommand> commands;
  private final MemberRegistry registry;
  private final Cadence cadence;
  private final Ticker ticker;
  private final IdleStrategy idleStrategy;
  private final long parkNanos;
  private final AtomicBoolean terminated;

  private volatile long currentStep;
  private long lastStepNanos;

  public CoordinationLoop(
      Queue<TickCommand> commands,
      MemberRegistry registry,
      TickManagerOptions options,
      AtomicBoolean terminated) {
    this.commands = commands;
    this.registry = registry;
    this.cadence = options.cadence();
    this.ticker = options.ticker();
    this.idleStrategy = options.idleStrategy();
    this.parkNanos = options.parkTime().toNanos();
    this.terminated = terminated;
    this.lastStepNanos = ticker.read();
  }

  @Override
  public void run() {
    LOGGER.info("Tick loop started with cadence {}", cadence);
    try {
      while (!Thread.currentThread().isInterrupted()) {
        if (!runOnce()) {
          LOGGER.info("Tick loop shut down at step {}", Long.toUnsignedString(currentStep));
          return;
        }
        idleStrategy.idle(parkNanos);
      }
      LOGGER.info("Tick loop interrupted at step {}", Long.toUnsignedString(currentStep));
    } finally {
      terminated.set(true);
    }
  }

  /**
   * Runs one iteration without idling.
   *
   * @return false once a {@code Shutdown} command has been consumed
   */
  @VisibleForTesting
  boolean runOnce() {
    if (!drainCommands()) {
      return false;
    }
    try {
      tryStep();
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure while evaluating step {}", nextStepString(), e);
    }
    return true;
  }

  /**
   * @return the last accepted step, read as unsigned
   */
  public long currentStep() {
    return currentStep;
  }

  private boolean drainCommands() {
    TickCommand command;
    while ((command = commands.poll()) != null) {
      if (command instanceof TickCommand.Shutdown) {
        return false;
      }
      try {
        apply(command);
      } catch (RuntimeException e) {
        LOGGER.error("Failed to apply {}", command, e);
      }
    }
    return true;
  }

  private void apply(TickCommand command) {
    if (command instanceof TickCommand.Register register) {
      long id = registry.register(register.speedFactor(), register.replyChannel(), ticker.read());
      if (!register.replyChannel().offer(new TickReply.SelfId(id))) {
        LOGGER.debug("Member {} registered but its reply channel refused the id", id);
      } else {
        LOGGER.debug("Member {} registered with speed factor {}", id, register.speedFactor());
      }
    } else if (command instanceof TickCommand.Unregister unregister) {
      if (registry.unregister(unregister.memberId())) {
        LOGGER.debug("Member {} unregistered", unregister.memberId());
      }
    } else if (command instanceof TickCommand.ChangeMemberState change) {
      registry.changeState(change.memberId(), change.state());
    }
  }

  private void tryStep() {
    long now = ticker.read();
    if (!cadence.isStepDue(lastStepNanos, now)) {
      return;
    }
    long candidate = currentStep + 1;
    MemberRegistry.Gate gate = registry.gate(candidate, now);
    if (gate.outcome() == MemberRegistry.Outcome.BLOCKED) {
      if (LOGGER.isTraceEnabled()) {
        LOGGER.trace(
            "Step {} held back, {} due member(s) not all ready",
            Long.toUnsignedString(candidate),
            gate.dueCount());
      }
      return;
    }

    currentStep = candidate;
    lastStepNanos = now;

    if (gate.outcome() == MemberRegistry.Outcome.OPEN) {
      deliver(candidate, gate);
    }
  }

  private void deliver(long step, MemberRegistry.Gate gate) {
    TickReply tick = new TickReply.Tick(step);
    for (ReplyChannel channel : gate.replyChannels()) {
      if (!channel.offer(tick)) {
        LOGGER.debug("Tick {} not delivered to {}", Long.toUnsignedString(step), channel);
      }
    }
    if (LOGGER.isTraceEnabled()) {
      LOGGER.trace("Step {} released {} member(s)", Long.toUnsignedString(step), gate.dueCount());
    }
  }

  private String nextStepString() {
    return Long.toUnsignedString(currentStep + 1);
  }
}
