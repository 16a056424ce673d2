package lockstep.api.spi;

import lockstep.api.TickManager;
import lockstep.api.TickManagerOptions;

/**
 * Creates tick managers. Implementations are discovered with {@link java.util.ServiceLoader}; the
 * first one found is used by {@link lockstep.api.Lockstep}.
 */
@FunctionalInterface
public interface TickManagerFactory {

  /**
   * Creates a manager and starts its coordination loop.
   *
   * @param options the manager settings
   * @return a running manager, owned by the caller
   */
  TickManager create(TickManagerOptions options);
}
