package lockstep.core.internal;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class ThreadUtils {

  private static final Logger LOGGER = LoggerFactory.getLogger(ThreadUtils.class);

  private static final AtomicInteger LOOP_SEQUENCE = new AtomicInteger();

  public static String getCurrentThreadId() {
    return String.format("%s-%d", Thread.currentThread().getName(), Thread.currentThread().getId());
  }

  /**
   * A factory for one tick loop thread. The thread is a daemon so that a manager that is never
   * closed cannot keep the JVM alive.
   *
   * @param nameFormat a {@link String#format} pattern; {@code %d} is replaced by a process-wide loop
   *     sequence number
   */
  public static ThreadFactory newLoopThreadFactory(String nameFormat) {
    String name = String.format(nameFormat, LOOP_SEQUENCE.getAndIncrement());
    return new ThreadFactoryBuilder()
        .setNameFormat(name.replace("%", "%%"))
        .setDaemon(true)
        .setUncaughtExceptionHandler(
            (thread, e) -> LOGGER.error("Tick loop thread {} died", thread.getName(), e))
        .build();
  }
}
