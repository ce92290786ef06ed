package cafe.woden.ircwire.app;

import cafe.woden.ircwire.irc.IrcMessage;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.FlowableTransformer;
import java.util.Objects;
import java.util.function.Supplier;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.reactivestreams.Publisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Offers each chat message passing through a client's inbound stream to a {@link MessageLogPort}.
 *
 * <p>Use as {@code client.messages().compose(forwarder)}. Only {@code PRIVMSG} and {@code NOTICE}
 * with a sender and a destination are logged. A failing port is logged and otherwise ignored; the
 * stream itself never sees it.
 */
@ApplicationLayer
public class MessageLogForwarder implements FlowableTransformer<IrcMessage, IrcMessage> {
  private static final Logger log = LoggerFactory.getLogger(MessageLogForwarder.class);

  private final MessageLogPort port;
  private final Supplier<String> serverAddress;

  public MessageLogForwarder(MessageLogPort port, Supplier<String> serverAddress) {
    this.port = Objects.requireNonNull(port, "port");
    this.serverAddress = Objects.requireNonNull(serverAddress, "serverAddress");
  }

  @Override
  public Publisher<IrcMessage> apply(Flowable<IrcMessage> upstream) {
    return upstream.doOnNext(this::offer);
  }

  void offer(IrcMessage m) {
    if (!m.isCommand("PRIVMSG") && !m.isCommand("NOTICE")) return;

    String nick = m.nick();
    String destination = m.param(0);
    if (nick == null || destination == null) return;

    String content = (m.trailing() != null) ? m.trailing() : m.param(1);
    if (content == null) return;

    try {
      port.logMessage(serverAddress.get(), nick, destination, content);
    } catch (RuntimeException e) {
      log.warn("[ircwire] Message log rejected {} -> {}", nick, destination, e);
    }
  }
}
