package cafe.woden.ircwire.config;

import cafe.woden.ircwire.util.NamedThreads;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * App-owned executors.
 *
 * <p>Session threads are created per connection by the client itself; only long-lived workers
 * live here so Spring owns their shutdown.
 */
@Configuration
public class ExecutorConfig {
  public static final String RECONNECT_SCHEDULER = "ircwireReconnectScheduler";

  @Bean(name = RECONNECT_SCHEDULER, destroyMethod = "shutdown")
  public ScheduledExecutorService reconnectScheduler() {
    return NamedThreads.newSingleThreadScheduledExecutor("ircwire-reconnect");
  }
}
