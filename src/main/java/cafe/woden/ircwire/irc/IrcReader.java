package cafe.woden.ircwire.irc;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only thing that reads from a session's transport.
 *
 * <p>Decodes each line, answers {@code PING} with {@code PONG} through the outbound queue (the
 * PING is not forwarded), hands every other message to {@code inbound} in wire order, and drops
 * malformed lines. A read failure or end-of-stream ends the session as a lost connection. The
 * reader never completes the inbound stream; that belongs to the coordinator.
 */
final class IrcReader implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(IrcReader.class);

  private static final long PONG_OFFER_SLICE_MS = 250;

  private final IrcSession session;
  private final BlockingQueue<String> outbound;
  private final Consumer<IrcMessage> inbound;

  IrcReader(IrcSession session, BlockingQueue<String> outbound, Consumer<IrcMessage> inbound) {
    this.session = Objects.requireNonNull(session, "session");
    this.outbound = Objects.requireNonNull(outbound, "outbound");
    this.inbound = Objects.requireNonNull(inbound, "inbound");
  }

  @Override
  public void run() {
    try {
      if (!session.awaitReady()) {
        log.debug("[ircwire] Reader for session {} ended before traffic started", session.id);
        return;
      }
      BufferedReader in =
          new BufferedReader(new InputStreamReader(session.transport.input(), StandardCharsets.UTF_8));
      while (true) {
        String line = in.readLine();
        if (line == null) {
          session.connectionLost("read", new EOFException("connection closed by peer"));
          return;
        }
        if (!handle(line)) return;
      }
    } catch (IOException e) {
      session.connectionLost("read", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("[ircwire] Reader for session {} interrupted", session.id);
    } finally {
      session.loopExited();
    }
  }

  /** @return false if the session ended while the line was being handled */
  private boolean handle(String line) throws InterruptedException {
    if (log.isTraceEnabled()) log.trace("[ircwire] << {}", line);

    IrcMessage message;
    try {
      message = IrcMessageCodec.parse(line);
    } catch (IrcParseException e) {
      log.debug("[ircwire] Dropping malformed line from {}: {}", session.address, e.getMessage());
      return true;
    }

    String pong = IrcMessageCodec.pongFor(message);
    if (pong != null) {
      return enqueue(pong);
    }

    inbound.accept(message);
    return true;
  }

  // Blocks under backpressure like any producer, but gives up once the session is over so the
  // coordinator's join cannot hang on a queue nobody drains.
  private boolean enqueue(String line) throws InterruptedException {
    while (!outbound.offer(line, PONG_OFFER_SLICE_MS, TimeUnit.MILLISECONDS)) {
      if (session.isEnded()) return false;
    }
    return true;
  }
}
