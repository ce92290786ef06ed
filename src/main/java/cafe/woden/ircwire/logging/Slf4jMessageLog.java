package cafe.woden.ircwire.logging;

import cafe.woden.ircwire.app.MessageLogPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default {@link MessageLogPort}: one line per message on the {@code ircwire.chatlog} logger. */
public class Slf4jMessageLog implements MessageLogPort {

  static final String LOGGER_NAME = "ircwire.chatlog";

  private final Logger chatlog;

  public Slf4jMessageLog() {
    this(LoggerFactory.getLogger(LOGGER_NAME));
  }

  Slf4jMessageLog(Logger chatlog) {
    this.chatlog = chatlog;
  }

  @Override
  public void logMessage(String serverAddress, String senderNick, String destination, String content) {
    chatlog.info("{} {} <{}> {}", serverAddress, destination, senderNick, content);
  }
}
