package lockstep.api;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.base.Ticker;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.time.Duration;
import java.util.IllegalFormatException;

/**
 * Settings of a tick manager. Only the cadence is required; everything else has a default.
 *
 * <pre>{@code
 * TickManagerOptions options =
 *     TickManagerOptions.builder(Cadence.fps(60))
 *         .replyTimeout(Duration.ofMillis(250))
 *         .idleStrategy(IdleStrategy.PARK)
 *         .build();
 * }</pre>
 */
public final class TickManagerOptions {

  public static final int DEFAULT_COMMAND_QUEUE_CAPACITY = 10;
  public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofSeconds(1);
  public static final Duration DEFAULT_PARK_TIME = Duration.ofMillis(1);
  public static final String DEFAULT_THREAD_NAME_FORMAT = "lockstep-tick-loop-%d";

  private final Cadence cadence;
  private final int commandQueueCapacity;
  private final Duration replyTimeout;
  private final IdleStrategy idleStrategy;
  private final Duration parkTime;
  private final Ticker ticker;
  private final String threadNameFormat;

  private TickManagerOptions(Builder builder) {
    this.cadence = builder.cadence;
    this.commandQueueCapacity = builder.commandQueueCapacity;
    this.replyTimeout = builder.replyTimeout;
    this.idleStrategy = builder.idleStrategy;
    this.parkTime = builder.parkTime;
    this.ticker = builder.ticker;
    this.threadNameFormat = builder.threadNameFormat;
  }

  public static Builder builder(Cadence cadence) {
    return new Builder(cadence);
  }

  public static TickManagerOptions of(Cadence cadence) {
    return builder(cadence).build();
  }

  public Cadence cadence() {
    return cadence;
  }

  /** Capacity of the bounded queue between client threads and the coordination loop. */
  public int commandQueueCapacity() {
    return commandQueueCapacity;
  }

  /**
   * How long a member waits for one reply before retrying (tick wait) or giving up (registration).
   */
  public Duration replyTimeout() {
    return replyTimeout;
  }

  public IdleStrategy idleStrategy() {
    return idleStrategy;
  }

  /** Park time per idle iteration, used by {@link IdleStrategy#PARK} only. */
  public Duration parkTime() {
    return parkTime;
  }

  /** The monotonic time source of the cadence. */
  public Ticker ticker() {
    return ticker;
  }

  public String threadNameFormat() {
    return threadNameFormat;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("cadence", cadence)
        .add("commandQueueCapacity", commandQueueCapacity)
        .add("replyTimeout", replyTimeout)
        .add("idleStrategy", idleStrategy)
        .add("parkTime", parkTime)
        .add("threadNameFormat", threadNameFormat)
        .toString();
  }

  public static final class Builder {
    private final Cadence cadence;
    private int commandQueueCapacity = DEFAULT_COMMAND_QUEUE_CAPACITY;
    private Duration replyTimeout = DEFAULT_REPLY_TIMEOUT;
    private IdleStrategy idleStrategy = IdleStrategy.YIELD;
    private Duration parkTime = DEFAULT_PARK_TIME;
    private Ticker ticker = Ticker.systemTicker();
    private String threadNameFormat = DEFAULT_THREAD_NAME_FORMAT;

    private Builder(Cadence cadence) {
      this.cadence = checkNotNull(cadence, "cadence");
    }

    @CanIgnoreReturnValue
    public Builder commandQueueCapacity(int capacity) {
      checkArgument(capacity > 0, "commandQueueCapacity must be positive: %s", capacity);
      this.commandQueueCapacity = capacity;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder replyTimeout(Duration timeout) {
      checkNotNull(timeout, "replyTimeout");
      checkArgument(
          !timeout.isNegative() && !timeout.isZero(), "replyTimeout must be positive: %s", timeout);
      this.replyTimeout = timeout;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder idleStrategy(IdleStrategy strategy) {
      this.idleStrategy = checkNotNull(strategy, "idleStrategy");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder parkTime(Duration time) {
      checkNotNull(time, "parkTime");
      checkArgument(!time.isNegative() && !time.isZero(), "parkTime must be positive: %s", time);
      this.parkTime = time;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder ticker(Ticker ticker) {
      this.ticker = checkNotNull(ticker, "ticker");
      return this;
    }

    @CanIgnoreReturnValue
    public Builder threadNameFormat(String format) {
      checkNotNull(format, "threadNameFormat");
      checkArgument(!format.isBlank(), "threadNameFormat must not be blank");
      checkArgument(
          acceptsSequenceNumber(format),
          "threadNameFormat must be a format taking one int argument: %s",
          format);
      this.threadNameFormat = format;
      return this;
    }

    private static boolean acceptsSequenceNumber(String format) {
      try {
        String.format(format, 0);
        return true;
      } catch (IllegalFormatException e) {
        return false;
      }
    }

    public TickManagerOptions build() {
      return new TickManagerOptions(this);
    }
  }
}
