package cafe.woden.ircwire.irc;

import cafe.woden.ircwire.net.IrcAddress;
import cafe.woden.ircwire.net.IrcConnectionException;
import cafe.woden.ircwire.net.IrcTransport;
import cafe.woden.ircwire.net.TransportConnector;
import cafe.woden.ircwire.util.NamedThreads;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import io.reactivex.rxjava3.processors.UnicastProcessor;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connection manager for one server.
 *
 * <p>Owns the transport, the outbound queue and the inbound message stream. Each successful
 * {@link #connect(String)} starts a session: a writer thread and a reader thread that wait on a
 * readiness barrier until registration has been written, plus a supervising thread that joins both
 * loops when the session ends and decides between {@link ConnectionState#RECONNECT_PENDING} and
 * terminal shutdown.
 *
 * <p>Retry is never done here. Watch {@link #reconnectSignal()} (or use
 * {@link ReconnectSupervisor}) and call {@code connect} again.
 */
public class IrcClient implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IrcClient.class);

  private static final AtomicLong SESSION_IDS = new AtomicLong();

  private final IrcClientSettings settings;
  private final TransportConnector connector;

  private final BlockingQueue<String> outbound;
  private final UnicastProcessor<IrcMessage> inbound = UnicastProcessor.create();
  private final BehaviorProcessor<ConnectionState> states =
      BehaviorProcessor.createDefault(ConnectionState.DISCONNECTED);

  private final QuitSignal quit = new QuitSignal();
  private final CountDownLatch terminated = new CountDownLatch(1);

  private final Object lock = new Object();
  private ConnectionState state = ConnectionState.DISCONNECTED;
  private IrcSession session;
  private CountDownLatch attemptDone;
  private boolean inboundClosed;

  private volatile ReconnectSignal reconnectSignal = new ReconnectSignal();
  private volatile String host;
  private volatile String serverAddress;

  public IrcClient(IrcClientSettings settings, TransportConnector connector) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.outbound = new LinkedBlockingQueue<>(settings.outboundCapacity());
  }

  /**
   * Open a connection and start the session loops.
   *
   * <p>Applies the default port (6667, or 6697 with TLS) when {@code address} has none. One
   * attempt only. A no-op while already connected. While another thread's attempt is in flight,
   * waits for its outcome: returns if it connected, otherwise makes an attempt of its own. If the
   * previous session is still being torn down, waits for that first.
   *
   * @throws IrcConnectionException resolve, dial, TLS handshake or registration failed
   * @throws IllegalStateException the client has been shut down
   */
  public void connect(String address) throws IrcConnectionException {
    IrcAddress target = IrcAddress.parse(address, settings.tls());

    CountDownLatch mine = null;
    while (mine == null) {
      awaitPreviousSession(target);
      CountDownLatch inFlight = null;
      synchronized (lock) {
        ensureNotShutDown();
        if (state == ConnectionState.CONNECTED) {
          log.debug("[ircwire] connect({}) ignored: already connected", target);
          return;
        }
        if (state == ConnectionState.CONNECTING && attemptDone != null) {
          inFlight = attemptDone;
        } else if (state != ConnectionState.CONNECTING) {
          setState(ConnectionState.CONNECTING);
          mine = new CountDownLatch(1);
          attemptDone = mine;
        }
        // CONNECTING without an attempt: its session ended during setup and is winding down.
      }
      if (inFlight != null) awaitAttempt(inFlight, target);
    }

    try {
      openSession(target);
    } finally {
      synchronized (lock) {
        if (attemptDone == mine) attemptDone = null;
        if (state == ConnectionState.CONNECTING && session == null) {
          setState(ConnectionState.DISCONNECTED);
        }
      }
      mine.countDown();
    }
  }

  private void openSession(IrcAddress target) throws IrcConnectionException {
    IrcTransport transport;
    try {
      transport = connector.open(target, settings.tls());
    } catch (IrcConnectionException | RuntimeException e) {
      log.warn("[ircwire] Connect to {} failed: {}", target, e.toString());
      synchronized (lock) {
        if (!quit.isTriggered()) setState(ConnectionState.DISCONNECTED);
      }
      throw e;
    }

    IrcSession s = new IrcSession(SESSION_IDS.incrementAndGet(), target, transport, quit);
    IrcWriter writer = new IrcWriter(s, outbound);
    IrcReader reader = new IrcReader(s, outbound, this::deliver);

    synchronized (lock) {
      if (quit.isTriggered()) {
        s.closeTransport();
        throw new IllegalStateException("client was shut down while connecting to " + target);
      }
      host = target.host();
      serverAddress = target.toString();
      session = s;
      reconnectSignal = s.reconnectSignal();

      Thread w = NamedThreads.unstarted("ircwire-writer-" + s.id, writer);
      s.attachWriter(w);
      w.start();
      NamedThreads.start("ircwire-reader-" + s.id, reader);
      NamedThreads.start("ircwire-session-" + s.id, () -> superviseSession(s));
    }

    try {
      writer.writeBeforeReady(settings.identity().registrationLines());
    } catch (IOException e) {
      s.abort(e);
      throw new IrcConnectionException(
          IrcConnectionException.Stage.REGISTER, target.toString(), e.getMessage(), e);
    }

    synchronized (lock) {
      if (!s.isEnded()) setState(ConnectionState.CONNECTED);
    }
    s.release();
  }

  /**
   * True while the socket from the latest successful connect is open and neither a quit nor a
   * connection loss has superseded it.
   */
  public boolean connected() {
    synchronized (lock) {
      IrcSession s = session;
      return state == ConnectionState.CONNECTED
          && s != null
          && !s.isEnded()
          && !quit.isTriggered()
          && s.isTransportOpen();
    }
  }

  /**
   * Queue a raw line for the writer; CRLF is appended if missing.
   *
   * <p>Blocks while the outbound queue is full. Lines queued while disconnected go out after the
   * next session's registration. Dropped after shutdown.
   */
  public void write(String line) {
    Objects.requireNonNull(line, "line");
    if (quit.isTriggered()) {
      log.debug("[ircwire] Dropping outbound line after shutdown: {}", line);
      return;
    }
    try {
      outbound.put(line);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while queueing outbound line", e);
    }
  }

  /** {@link #write(String)} with {@link String#format} semantics (root locale). */
  public void writef(String format, Object... args) {
    write(String.format(Locale.ROOT, format, args));
  }

  /** Quit with the configured quit message. */
  public void quit() {
    quit(null);
  }

  /**
   * Graceful, terminal shutdown.
   *
   * <p>Queues {@code QUIT :reason} (best effort, never blocks), fires the quit signal and lets the
   * session wind down; the inbound stream completes once both loops have exited. Without an active
   * session the shutdown completes immediately and nothing is sent. Repeated calls are no-ops.
   */
  public void quit(String reason) {
    String why = (reason == null || reason.isBlank()) ? settings.quitMessage() : reason;
    synchronized (lock) {
      if (!quit.trigger()) {
        log.debug("[ircwire] Quit already requested");
        return;
      }
      IrcSession s = session;
      setState(ConnectionState.CLOSING);
      if (s == null) {
        finishShutdownLocked();
        return;
      }
      if (!s.isEnded()) {
        if (!outbound.offer("QUIT :" + why)) {
          log.warn("[ircwire] Outbound queue full; QUIT notice to {} not sent", s.address);
        }
        s.end(new SessionEnd.Quit(Instant.now(), why));
      }
    }
  }

  /** Wait for terminal shutdown (inbound stream completed). */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  /** {@link #quit()} and wait a bounded time for the session to wind down. */
  @Override
  public void close() {
    quit();
    try {
      if (!awaitTermination(settings.quitGrace().plusSeconds(1))) {
        log.warn("[ircwire] Client did not terminate within {}", settings.quitGrace().plusSeconds(1));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Decoded inbound messages in wire order, keep-alive PINGs excluded. Single subscriber; buffers
   * until subscribed. Completes exactly once, at terminal shutdown.
   */
  public Flowable<IrcMessage> messages() {
    return inbound.hide();
  }

  /** State transitions; replays the current state. Completes at terminal shutdown. */
  public Flowable<ConnectionState> states() {
    return states.hide();
  }

  /** Reconnect signal of the latest session (replaced on every connect). */
  public ReconnectSignal reconnectSignal() {
    return reconnectSignal;
  }

  public ConnectionState state() {
    synchronized (lock) {
      return state;
    }
  }

  public boolean isShutDown() {
    return quit.isTriggered();
  }

  /** Host of the latest successful connect, or {@code null}. */
  public String host() {
    return host;
  }

  /** {@code host:port} of the latest successful connect, or {@code null}. */
  public String serverAddress() {
    return serverAddress;
  }

  public IrcClientSettings settings() {
    return settings;
  }

  BlockingQueue<String> outboundQueue() {
    return outbound;
  }

  private void deliver(IrcMessage message) {
    inbound.onNext(message);
  }

  private void superviseSession(IrcSession s) {
    try {
      SessionEnd why = s.awaitEnd();
      if (why instanceof SessionEnd.Quit) {
        // Give the server a chance to close its side after QUIT.
        if (!s.awaitLoopsExited(settings.quitGrace())) {
          log.debug("[ircwire] {} did not close within {}; closing locally", s.address, settings.quitGrace());
        }
      }
      s.closeTransport();
      s.awaitLoopsExited();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      s.closeTransport();
    } finally {
      afterSession(s);
      s.markTerminated();
    }
  }

  private void afterSession(IrcSession s) {
    synchronized (lock) {
      if (session == s) session = null;
      if (quit.isTriggered()) {
        finishShutdownLocked();
        return;
      }

      SessionEnd why = s.endReason();
      if (why instanceof SessionEnd.ConnectionLost lost && "setup".equals(lost.source())) {
        // No traffic moved; what was queued before connect waits for the next registration.
        setState(ConnectionState.DISCONNECTED);
        return;
      }

      int dropped = outbound.size();
      outbound.clear();
      if (dropped > 0) {
        log.info("[ircwire] Discarded {} queued line(s) from the ended session to {}", dropped, s.address);
      }
      setState(ConnectionState.RECONNECT_PENDING);
    }
  }

  private void finishShutdownLocked() {
    if (inboundClosed) return;
    inboundClosed = true;

    inbound.onComplete();
    reconnectSignal.close();
    outbound.clear();
    setState(ConnectionState.DISCONNECTED);
    states.onComplete();
    terminated.countDown();
    log.info("[ircwire] Client for {} shut down", Objects.toString(serverAddress, "<never connected>"));
  }

  private void awaitPreviousSession(IrcAddress target) throws IrcConnectionException {
    IrcSession previous;
    synchronized (lock) {
      previous = session;
    }
    if (previous == null || !previous.isEnded()) return;
    try {
      previous.awaitTerminated();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IrcConnectionException(
          IrcConnectionException.Stage.DIAL, target.toString(), "interrupted while the previous session closed", e);
    }
  }

  private void awaitAttempt(CountDownLatch inFlight, IrcAddress target) throws IrcConnectionException {
    log.debug("[ircwire] connect({}) waiting for the attempt in flight", target);
    try {
      inFlight.await();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IrcConnectionException(
          IrcConnectionException.Stage.DIAL, target.toString(), "interrupted while another connect was in flight", e);
    }
  }

  private void ensureNotShutDown() {
    if (quit.isTriggered()) throw new IllegalStateException("client has been shut down");
  }

  private void setState(ConnectionState next) {
    if (state == next) return;
    log.info("[ircwire] {} -> {}{}", state, next, serverAddress == null ? "" : " (" + serverAddress + ")");
    state = next;
    states.onNext(next);
  }
}
