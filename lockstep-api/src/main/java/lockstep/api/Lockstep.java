package lockstep.api;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.errorprone.annotations.MustBeClosed;
import lockstep.api.spi.TickManagerFactory;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Entry point for creating tick managers.
 *
 * <pre>{@code
 * try (TickManager manager = Lockstep.newTickManager(Cadence.fps(60))) {
 *   TickManagerHandle handle = manager.handle();
 *   // hand the handle to worker threads, each creating its own TickMember
 * }
 * }</pre>
 *
 * <p>Every call returns an independent manager; managers never share members, ids or threads.
 */
public final class Lockstep {

  private static final Supplier<TickManagerFactory> FACTORY = Suppliers.memoize(Lockstep::load);

  private Lockstep() {}

  @MustBeClosed
  public static TickManager newTickManager(Cadence cadence) {
    return newTickManager(TickManagerOptions.of(cadence));
  }

  @MustBeClosed
  public static TickManager newTickManager(TickManagerOptions options) {
    checkNotNull(options, "options");
    return FACTORY.get().create(options);
  }

  private static TickManagerFactory load() {
    Iterator<TickManagerFactory> factories =
        ServiceLoader.load(TickManagerFactory.class, Lockstep.class.getClassLoader()).iterator();
    if (!factories.hasNext()) {
      throw new LockstepException(
          "No " + TickManagerFactory.class.getName() + " implementation found on the class path");
    }
    return factories.next();
  }
}
