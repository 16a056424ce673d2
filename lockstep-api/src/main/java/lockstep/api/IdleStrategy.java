package lockstep.api;

import java.util.concurrent.locks.LockSupport;

/** How the coordination loop gives up the processor between two iterations. */
public enum IdleStrategy {

  /** {@link Thread#yield()}: cooperative, lowest latency that still lets other threads run. */
  YIELD {
    @Override
    public void idle(long parkNanos) {
      Thread.yield();
    }
  },

  /** {@link Thread#onSpinWait()}: busy spin, CPU hungry. */
  SPIN {
    @Override
    public void idle(long parkNanos) {
      Thread.onSpinWait();
    }
  },

  /** {@link LockSupport#parkNanos(long)}: low CPU, adds up to {@code parkNanos} of latency. */
  PARK {
    @Override
    public void idle(long parkNanos) {
      LockSupport.parkNanos(parkNanos);
    }
  };

  public abstract void idle(long parkNanos);
}
