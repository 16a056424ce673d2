package lockstep.core.internal;

import com.google.auto.service.AutoService;
import lockstep.api.TickManager;
import lockstep.api.TickManagerOptions;
import lockstep.api.spi.TickManagerFactory;

@AutoService(TickManagerFactory.class)
public class DefaultTickManagerFactory implements TickManagerFactory {

  @Override
  public TickManager create(TickManagerOptions options) {
    return new DefaultTickManager(options);
  }
}
