package lockstep.core.internal.loop;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import lockstep.api.MemberSnapshot;
import lockstep.api.MemberState;
import lockstep.api.SpeedFactors;
import lockstep.api.command.ReplyChannel;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The members of one tick manager, keyed by id.
 *
 * <p>Only the coordination loop mutates the registry. Other threads may read snapshots. Every
 * method holds the lock for a short, non-blocking section and none of them sends on a reply
 * channel; delivery is left to the caller after the lock is released.
 *
 * <p>Ids come from a counter that is never decremented, so an id is never handed out twice, no
 * matter how members come and go.
 */
@ThreadSafe
public final class MemberRegistry {

  /** Result of evaluating the gate for one candidate step. */
  public enum Outcome {
    /** No registered member is due on the step. */
    EMPTY,
    /** At least one due member is still {@link MemberState#RUNNING}. Nothing was changed. */
    BLOCKED,
    /** Every due member was ready and has been marked as ticked. */
    OPEN
  }

  /**
   * @param outcome what the gate decided
   * @param dueCount number of members due on the step
   * @param replyChannels channels of the released members; empty unless {@code outcome} is OPEN
   */
  public record Gate(Outcome outcome, int dueCount, List<ReplyChannel> replyChannels) {

    static final Gate EMPTY = new Gate(Outcome.EMPTY, 0, ImmutableList.of());

    static Gate blocked(int dueCount) {
      return new Gate(Outcome.BLOCKED, dueCount, ImmutableList.of());
    }
  }

  private final ReentrantLock lock = new ReentrantLock();
  private final AtomicLong nextId = new AtomicLong();

  @GuardedBy("lock")
  private final Map<Long, MemberRecord> members = new TreeMap<>();

  /**
   * Adds a member in state {@link MemberState#RUNNING}.
   *
   * @return the assigned id
   */
  public long register(int speedFactor, ReplyChannel replyChannel, long nowNanos) {
    lock.lock();
    try {
      long id = nextId.getAndIncrement();
      members.put(
          id, new MemberRecord(id, SpeedFactors.normalize(speedFactor), replyChannel, nowNanos));
      return id;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return true if the member existed
   */
  @CanIgnoreReturnValue
  public boolean unregister(long id) {
    lock.lock();
    try {
      return members.remove(id) != null;
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return true if the member existed
   */
  @CanIgnoreReturnValue
  public boolean changeState(long id, MemberState state) {
    lock.lock();
    try {
      MemberRecord record = members.get(id);
      if (record == null) {
        return false;
      }
      record.setState(state);
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Evaluates the gate for {@code step} and, if it opens, marks every due member as ticked.
   *
   * <p>Members whose reply channel has been closed are dropped first; nobody is left to receive
   * their ticks, so they must not hold the gate shut.
   *
   * @param step the candidate step number, read as unsigned
   * @param nowNanos timestamp recorded as the last tick of released members
   */
  public Gate gate(long step, long nowNanos) {
    lock.lock();
    try {
      List<MemberRecord> due = new ArrayList<>();
      boolean ready = true;
      Iterator<MemberRecord> it = members.values().iterator();
      while (it.hasNext()) {
        MemberRecord record = it.next();
        if (record.replyChannel().isClosed()) {
          it.remove();
          continue;
        }
        if (SpeedFactors.isDue(step, record.speedFactor())) {
          due.add(record);
          ready &= record.state().isReady();
        }
      }
      if (due.isEmpty()) {
        return Gate.EMPTY;
      }
      if (!ready) {
        return Gate.blocked(due.size());
      }
      ImmutableList.Builder<ReplyChannel> channels =
          ImmutableList.builderWithExpectedSize(due.size());
      for (MemberRecord record : due) {
        record.markTicked(nowNanos);
        channels.add(record.replyChannel());
      }
      return new Gate(Outcome.OPEN, due.size(), channels.build());
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return members.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return snapshots of all members, ordered by id
   */
  public List<MemberSnapshot> snapshot() {
    lock.lock();
    try {
      return members.values().stream()
          .map(MemberRecord::snapshot)
          .collect(ImmutableList.toImmutableList());
    } finally {
      lock.unlock();
    }
  }

  public Optional<MemberSnapshot> snapshot(long id) {
    lock.lock();
    try {
      return Optional.ofNullable(members.get(id)).map(MemberRecord::snapshot);
    } finally {
      lock.unlock();
    }
  }
}
