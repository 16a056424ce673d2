package lockstep.core.internal;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.util.concurrent.Uninterruptibles;
import com.google.errorprone.annotations.ThreadSafe;
import lockstep.api.Cadence;
import lockstep.api.MemberSnapshot;
import lockstep.api.TickManager;
import lockstep.api.TickManagerHandle;
import lockstep.api.TickManagerOptions;
import lockstep.api.command.TickCommand;
import lockstep.core.internal.loop.CoordinationLoop;
import lockstep.core.internal.loop.MemberRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The default {@link TickManager}: a {@link CoordinationLoop} on its own daemon thread, fed through
 * a bounded {@link ArrayBlockingQueue}.
 *
 * <p>{@link #close()} enqueues {@code Shutdown} and joins the loop thread. If the queue stays full
 * for longer than {@link #SHUTDOWN_OFFER_MILLIS} the loop thread is interrupted instead, which ends
 * it just the same.
 */
@ThreadSafe
public class DefaultTickManager implements TickManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultTickManager.class);

  static final long SHUTDOWN_OFFER_MILLIS = 200;

  private final TickManagerOptions options;
  private final BlockingQueue<TickCommand> commands;
  private final MemberRegistry registry = new MemberRegistry();
  private final AtomicBoolean terminated = new AtomicBoolean(false);
  private final CoordinationLoop loop;
  private final DefaultTickManagerHandle handle;
  private final Thread loopThread;

  private boolean closed;

  public DefaultTickManager(TickManagerOptions options) {
    this.options = checkNotNull(options, "options");
    this.commands = new ArrayBlockingQueue<>(options.commandQueueCapacity());
    this.handle = new DefaultTickManagerHandle(commands, terminated, options.replyTimeout());
    this.loop = new CoordinationLoop(commands, registry, options, terminated);
    this.loopThread = ThreadUtils.newLoopThreadFactory(options.threadNameFormat()).newThread(loop);
    this.loopThread.start();
    LOGGER.debug("Started tick manager on {} with {}", loopThread.getName(), options);
  }

  @Override
  public TickManagerHandle handle() {
    return handle;
  }

  @Override
  public Cadence cadence() {
    return options.cadence();
  }

  @Override
  public long currentStep() {
    return loop.currentStep();
  }

  @Override
  public List<MemberSnapshot> members() {
    return registry.snapshot();
  }

  @Override
  public Optional<MemberSnapshot> member(long memberId) {
    return registry.snapshot(memberId);
  }

  @Override
  public boolean isRunning() {
    return !terminated.get();
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (!terminated.get()) {
      requestShutdown();
    }
    Uninterruptibles.joinUninterruptibly(loopThread);
    LOGGER.debug(
        "Tick manager on {} closed with {} member(s) registered",
        loopThread.getName(),
        registry.size());
  }

  private void requestShutdown() {
    try {
      if (commands.offer(TickCommand.SHUTDOWN, SHUTDOWN_OFFER_MILLIS, TimeUnit.MILLISECONDS)) {
        return;
      }
      LOGGER.warn("Command queue of {} stayed full, interrupting it", loopThread.getName());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    loopThread.interrupt();
  }
}
