package cafe.woden.ircwire.irc;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-client settings, fixed before the first connect.
 *
 * @param tls dial with TLS; also selects the default port (6697 instead of 6667)
 * @param identity registration sent during session setup
 * @param outboundCapacity bound of the outbound queue; producers block when it is full
 * @param quitGrace how long to wait for the server to close after QUIT before closing ourselves
 * @param quitMessage reason sent with QUIT when none is given
 */
public record IrcClientSettings(
    boolean tls,
    IrcIdentity identity,
    int outboundCapacity,
    Duration quitGrace,
    String quitMessage
) {

  public IrcClientSettings {
    if (identity == null) identity = IrcIdentity.NONE;
    if (outboundCapacity <= 0) outboundCapacity = 1_024;
    quitGrace = Objects.requireNonNullElse(quitGrace, Duration.ofSeconds(2));
    if (quitGrace.isNegative()) quitGrace = Duration.ZERO;
    if (quitMessage == null || quitMessage.isBlank()) quitMessage = "Bye";
  }

  public static IrcClientSettings plain() {
    return new IrcClientSettings(false, IrcIdentity.NONE, 1_024, Duration.ofSeconds(2), "Bye");
  }

  public IrcClientSettings withTls(boolean enabled) {
    return new IrcClientSettings(enabled, identity, outboundCapacity, quitGrace, quitMessage);
  }

  public IrcClientSettings withIdentity(IrcIdentity id) {
    return new IrcClientSettings(tls, id, outboundCapacity, quitGrace, quitMessage);
  }

  public IrcClientSettings withQuitGrace(Duration grace) {
    return new IrcClientSettings(tls, identity, outboundCapacity, grace, quitMessage);
  }
}
