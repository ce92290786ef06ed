package cafe.woden.ircwire.irc;

import cafe.woden.ircwire.net.IrcAddress;
import cafe.woden.ircwire.net.IrcTransport;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State for one connection attempt: the borrowed transport plus the synchronization points shared
 * by the reader, the writer and the coordinator.
 *
 * <p>Three counting points: {@code ready} (1, released by the coordinator after setup),
 * {@code ended} (1, first {@link SessionEnd} wins) and {@code loopsExited} (2, one per loop).
 */
final class IrcSession {
  private static final Logger log = LoggerFactory.getLogger(IrcSession.class);

  final long id;
  final IrcAddress address;
  final IrcTransport transport;

  private final QuitSignal quit;
  private final ReconnectSignal reconnect = new ReconnectSignal();

  private final CountDownLatch ready = new CountDownLatch(1);
  private final CountDownLatch ended = new CountDownLatch(1);
  private final CountDownLatch loopsExited = new CountDownLatch(2);
  private final CountDownLatch terminated = new CountDownLatch(1);

  private final AtomicReference<SessionEnd> end = new AtomicReference<>();
  private final AtomicBoolean transportClosed = new AtomicBoolean(false);

  private volatile Thread writerThread;

  IrcSession(long id, IrcAddress address, IrcTransport transport, QuitSignal quit) {
    this.id = id;
    this.address = Objects.requireNonNull(address, "address");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.quit = Objects.requireNonNull(quit, "quit");
  }

  ReconnectSignal reconnectSignal() {
    return reconnect;
  }

  void attachWriter(Thread writer) {
    this.writerThread = writer;
  }

  /** Setup is complete; loops may start moving traffic. */
  void release() {
    ready.countDown();
  }

  /**
   * Wait for the readiness barrier.
   *
   * @return false when the session ended before (or while) waiting
   */
  boolean awaitReady() throws InterruptedException {
    ready.await();
    return end.get() == null;
  }

  /**
   * Record why the session stops, release anything waiting on the barrier and wake the writer.
   *
   * @return true if {@code why} is the recorded end
   */
  boolean end(SessionEnd why) {
    if (!end.compareAndSet(null, why)) return false;
    ended.countDown();
    ready.countDown();
    // The reader is not interrupted: inbound subscribers may run on its thread. It unblocks when
    // the coordinator closes the transport.
    wake(writerThread);
    return true;
  }

  /**
   * A loop hit an I/O failure. Raises the reconnect signal unless shutdown was already requested
   * or something else ended the session first.
   */
  void connectionLost(String source, Throwable cause) {
    if (quit.isTriggered()) {
      end(new SessionEnd.Quit(Instant.now(), "quit"));
      log.debug("[ircwire] Session {} {} stopped during shutdown: {}", id, source, describe(cause));
      return;
    }
    SessionEnd.ConnectionLost lost =
        new SessionEnd.ConnectionLost(Instant.now(), address.toString(), source, cause);
    if (end(lost)) {
      log.warn("[ircwire] Connection to {} lost ({} failed: {})", address, source, describe(cause));
      reconnect.fire(lost);
    } else {
      log.debug("[ircwire] Session {} {} failure after end: {}", id, source, describe(cause));
    }
  }

  /** Ends the session for a setup failure without raising the reconnect signal. */
  void abort(Throwable cause) {
    end(new SessionEnd.ConnectionLost(Instant.now(), address.toString(), "setup", cause));
  }

  boolean isEnded() {
    return end.get() != null;
  }

  SessionEnd endReason() {
    return end.get();
  }

  SessionEnd awaitEnd() throws InterruptedException {
    ended.await();
    return end.get();
  }

  void loopExited() {
    loopsExited.countDown();
  }

  boolean awaitLoopsExited(Duration timeout) throws InterruptedException {
    return loopsExited.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  void awaitLoopsExited() throws InterruptedException {
    loopsExited.await();
  }

  void closeTransport() {
    if (!transportClosed.compareAndSet(false, true)) return;
    try {
      transport.close();
    } catch (IOException e) {
      log.debug("[ircwire] Closing transport for session {} failed", id, e);
    }
  }

  boolean isTransportOpen() {
    return !transportClosed.get() && transport.isOpen();
  }

  void markTerminated() {
    terminated.countDown();
  }

  boolean awaitTerminated(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  void awaitTerminated() throws InterruptedException {
    terminated.await();
  }

  private static void wake(Thread t) {
    if (t != null && t != Thread.currentThread()) t.interrupt();
  }

  private static String describe(Throwable t) {
    if (t == null) return "unknown";
    String msg = t.getMessage();
    return t.getClass().getSimpleName() + (msg == null ? "" : ": " + msg);
  }
}
