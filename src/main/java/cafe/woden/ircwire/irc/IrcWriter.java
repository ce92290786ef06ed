package cafe.woden.ircwire.irc;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The only thing that writes to a session's transport.
 *
 * <p>Drains the client's outbound queue in submission order, terminating each line with CRLF. On
 * quit it flushes whatever is still queued (best effort) and half-closes the output. On a write
 * failure it discards the queued lines and reports the connection as lost.
 */
final class IrcWriter implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(IrcWriter.class);

  private final IrcSession session;
  private final BlockingQueue<String> outbound;

  IrcWriter(IrcSession session, BlockingQueue<String> outbound) {
    this.session = Objects.requireNonNull(session, "session");
    this.outbound = Objects.requireNonNull(outbound, "outbound");
  }

  @Override
  public void run() {
    try {
      if (!session.awaitReady()) {
        log.debug("[ircwire] Writer for session {} ended before traffic started", session.id);
        return;
      }
      OutputStream out = session.transport.output();
      while (!session.isEnded()) {
        String line;
        try {
          line = outbound.take();
        } catch (InterruptedException e) {
          // Woken by end(); the loop condition decides what happens next.
          continue;
        }
        try {
          send(out, line);
        } catch (IOException e) {
          int dropped = discardQueued();
          if (dropped > 0) {
            log.warn("[ircwire] Discarding {} queued line(s) after write failure", dropped);
          }
          session.connectionLost("write", e);
          return;
        }
      }
      if (session.endReason() instanceof SessionEnd.Quit) {
        drainOnQuit(out);
      }
    } catch (InterruptedException e) {
      log.debug("[ircwire] Writer for session {} interrupted before traffic started", session.id);
    } catch (IOException e) {
      session.connectionLost("write", e);
    } finally {
      session.loopExited();
    }
  }

  /**
   * Write setup lines (registration) straight to the transport. Only valid before the readiness
   * barrier is released, while no loop is moving traffic.
   */
  void writeBeforeReady(Iterable<String> lines) throws IOException {
    OutputStream out = session.transport.output();
    for (String line : lines) {
      send(out, line);
    }
  }

  private void send(OutputStream out, String line) throws IOException {
    out.write(IrcMessageCodec.terminate(line).getBytes(StandardCharsets.UTF_8));
    out.flush();
    if (log.isTraceEnabled()) log.trace("[ircwire] >> {}", line.strip());
  }

  private void drainOnQuit(OutputStream out) {
    String line;
    try {
      while ((line = outbound.poll()) != null) {
        send(out, line);
      }
      session.transport.shutdownOutput();
    } catch (IOException e) {
      int dropped = discardQueued();
      log.debug("[ircwire] Flush on quit stopped early ({} line(s) dropped)", dropped, e);
    }
  }

  private int discardQueued() {
    int n = 0;
    while (outbound.poll() != null) n++;
    return n;
  }
}
