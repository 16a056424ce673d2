package lockstep.api;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * The rate at which a tick manager may start new steps, given either as a frame rate or as an
 * explicit interval.
 *
 * <p>A cadence only answers whether enough time has passed since the last accepted step. It holds
 * no state of its own; the caller supplies both timestamps from a monotonic source such as {@link
 * System#nanoTime()}.
 *
 * <p>The period boundary is inclusive: a step is due when exactly one period has elapsed.
 */
@Immutable
public sealed interface Cadence permits Cadence.Fps, Cadence.Interval {

  static Cadence fps(int framesPerSecond) {
    return new Fps(framesPerSecond);
  }

  static Cadence interval(Duration period) {
    return new Interval(period);
  }

  /**
   * @return the step period in nanoseconds, always positive
   */
  long periodNanos();

  default Duration period() {
    return Duration.ofNanos(periodNanos());
  }

  /**
   * Decides whether a new step may start.
   *
   * @param lastStepNanos monotonic timestamp of the last accepted step
   * @param nowNanos monotonic timestamp of now
   * @return true iff at least one full period has elapsed since {@code lastStepNanos}
   */
  default boolean isStepDue(long lastStepNanos, long nowNanos) {
    // Subtraction keeps the comparison correct across nanoTime overflow.
    return nowNanos - lastStepNanos >= periodNanos();
  }

  /** A cadence of {@code framesPerSecond} steps per second. */
  record Fps(int framesPerSecond) implements Cadence {

    public Fps {
      checkArgument(framesPerSecond > 0, "framesPerSecond must be positive: %s", framesPerSecond);
      checkArgument(
          framesPerSecond <= TimeUnit.SECONDS.toNanos(1),
          "framesPerSecond must not exceed one step per nanosecond: %s",
          framesPerSecond);
    }

    @Override
    public long periodNanos() {
      return TimeUnit.SECONDS.toNanos(1) / framesPerSecond;
    }
  }

  /** A cadence of one step every {@code duration}. */
  record Interval(Duration duration) implements Cadence {

    public Interval {
      checkNotNull(duration, "duration");
      checkArgument(
          !duration.isNegative() && !duration.isZero(), "duration must be positive: %s", duration);
    }

    @Override
    public long periodNanos() {
      return duration.toNanos();
    }
  }
}
