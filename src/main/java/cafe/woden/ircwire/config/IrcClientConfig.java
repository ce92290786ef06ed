package cafe.woden.ircwire.config;

import cafe.woden.ircwire.app.MessageLogForwarder;
import cafe.woden.ircwire.app.MessageLogPort;
import cafe.woden.ircwire.irc.IrcClient;
import cafe.woden.ircwire.irc.IrcClientSettings;
import cafe.woden.ircwire.irc.IrcCommands;
import cafe.woden.ircwire.irc.IrcIdentity;
import cafe.woden.ircwire.irc.ReconnectSupervisor;
import cafe.woden.ircwire.logging.Slf4jMessageLog;
import cafe.woden.ircwire.net.SocketTransportConnector;
import cafe.woden.ircwire.net.TransportConnector;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires one {@link IrcClient} from {@link IrcProperties}. */
@Configuration
public class IrcClientConfig {

  static IrcClientSettings settingsFrom(IrcProperties props) {
    IrcProperties.Client c = props.client();
    IrcProperties.Server s = props.server();
    IrcIdentity identity =
        s.nick().isBlank()
            ? IrcIdentity.NONE
            : new IrcIdentity(s.nick(), s.username(), s.realName(), s.password());
    return new IrcClientSettings(
        s.tls(),
        identity,
        c.outbound().queueCapacity(),
        Duration.ofMillis(c.socket().quitGraceMs()),
        c.quitMessage());
  }

  @Bean
  public IrcClientSettings ircClientSettings(IrcProperties props) {
    return settingsFrom(props);
  }

  @Bean
  public TransportConnector transportConnector(IrcProperties props) {
    return new SocketTransportConnector(props.client());
  }

  @Bean(destroyMethod = "close")
  public IrcClient ircClient(IrcClientSettings settings, TransportConnector connector) {
    return new IrcClient(settings, connector);
  }

  @Bean
  public IrcCommands ircCommands(IrcClient client) {
    return new IrcCommands(client);
  }

  @Bean(destroyMethod = "close")
  public ReconnectSupervisor reconnectSupervisor(
      IrcClient client,
      IrcProperties props,
      @Qualifier(ExecutorConfig.RECONNECT_SCHEDULER) ScheduledExecutorService reconnectExec) {
    return new ReconnectSupervisor(client, props.client().reconnect(), Schedulers.from(reconnectExec));
  }

  @Bean
  public MessageLogForwarder messageLogForwarder(
      IrcClient client, ObjectProvider<MessageLogPort> ports) {
    MessageLogPort port = ports.getIfAvailable(Slf4jMessageLog::new);
    return new MessageLogForwarder(port, client::serverAddress);
  }
}
