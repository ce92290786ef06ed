package cafe.woden.ircwire;

import cafe.woden.ircwire.app.MessageLogForwarder;
import cafe.woden.ircwire.config.IrcProperties;
import cafe.woden.ircwire.irc.IrcClient;
import cafe.woden.ircwire.irc.ReconnectSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(IrcProperties.class)
public class IrcWireApp {
  private static final Logger log = LoggerFactory.getLogger(IrcWireApp.class);

  public static void main(String[] args) {
    SpringApplication.run(IrcWireApp.class, args);
  }

  @Bean
  public ApplicationRunner autoConnect(
      IrcProperties props,
      IrcClient client,
      ReconnectSupervisor supervisor,
      MessageLogForwarder forwarder) {
    return args -> {
      IrcProperties.Server server = props.server();
      if (!server.autoConnect()) {
        log.info("[ircwire] auto-connect disabled; waiting for an explicit connect");
        return;
      }

      client
          .messages()
          .compose(forwarder)
          .subscribe(
              m -> log.debug("[ircwire] {}", m),
              err -> log.error("[ircwire] Inbound stream failed", err),
              () -> log.info("[ircwire] Inbound stream closed"));

      supervisor.start(server.address());
    };
  }
}
