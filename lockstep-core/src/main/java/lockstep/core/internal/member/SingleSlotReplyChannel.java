package lockstep.core.internal.member;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.ThreadSafe;
import lockstep.api.command.ReplyChannel;
import lockstep.api.command.TickReply;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A reply channel holding at most one undelivered reply. The loop offers without blocking; the
 * owning member receives with a timeout.
 */
@ThreadSafe
public final class SingleSlotReplyChannel implements ReplyChannel {

  private final BlockingQueue<TickReply> slot = new ArrayBlockingQueue<>(1);
  private volatile boolean closed;

  @Override
  public boolean offer(TickReply reply) {
    return !closed && slot.offer(reply);
  }

  @Override
  public boolean isClosed() {
    return closed;
  }

  /**
   * @return the next reply, or null if none arrived within {@code timeout}
   */
  public TickReply poll(Duration timeout) throws InterruptedException {
    return slot.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /** Discards a reply that was delivered but never received. */
  public void clear() {
    slot.clear();
  }

  /** Abandons the channel. Later offers are refused and a pending reply is discarded. */
  public void close() {
    closed = true;
    slot.clear();
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("closed", closed)
        .add("pending", slot.size())
        .toString();
  }
}
