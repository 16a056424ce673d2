package lockstep.core.internal.loop;

import lockstep.api.MemberSnapshot;
import lockstep.api.MemberState;
import lockstep.api.command.ReplyChannel;

/** Mutable per-member bookkeeping. Only touched while holding the {@link MemberRegistry} lock. */
final class MemberRecord {

  private final long id;
  private final int speedFactor;
  private final ReplyChannel replyChannel;
  private MemberState state = MemberState.RUNNING;
  private long lastTickNanos;
  private long ticksDelivered;

  MemberRecord(long id, int speedFactor, ReplyChannel replyChannel, long registeredNanos) {
    this.id = id;
    this.speedFactor = speedFactor;
    this.replyChannel = replyChannel;
    this.lastTickNanos = registeredNanos;
  }

  long id() {
    return id;
  }

  int speedFactor() {
    return speedFactor;
  }

  ReplyChannel replyChannel() {
    return replyChannel;
  }

  MemberState state() {
    return state;
  }

  void setState(MemberState state) {
    this.state = state;
  }

  /** FINISHED returns to RUNNING; HIDDEN stays HIDDEN. */
  void markTicked(long nowNanos) {
    if (state == MemberState.FINISHED) {
      state = MemberState.RUNNING;
    }
    lastTickNanos = nowNanos;
    ticksDelivered++;
  }

  MemberSnapshot snapshot() {
    return new MemberSnapshot(id, speedFactor, state, lastTickNanos, ticksDelivered);
  }
}
