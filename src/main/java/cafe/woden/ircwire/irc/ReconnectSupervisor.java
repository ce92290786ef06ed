package cafe.woden.ircwire.irc;

import cafe.woden.ircwire.config.IrcProperties;
import cafe.woden.ircwire.net.IrcConnectionException;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Maybe;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caller-side retry policy: watches each session's {@link ReconnectSignal} and calls
 * {@link IrcClient#connect(String)} again with exponential backoff.
 *
 * <p>All connect attempts after the first run on {@code timerScheduler}; waiting for the signal
 * happens on {@link Schedulers#io()}.
 */
public class ReconnectSupervisor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ReconnectSupervisor.class);

  private final IrcClient client;
  private final IrcProperties.Reconnect policy;
  private final Scheduler timerScheduler;

  private final AtomicBoolean stopped = new AtomicBoolean(true);
  private final AtomicLong attempts = new AtomicLong(0);
  private final AtomicReference<Disposable> pending = new AtomicReference<>();
  private volatile String address;

  public ReconnectSupervisor(IrcClient client, IrcProperties.Reconnect policy, Scheduler timerScheduler) {
    this.client = Objects.requireNonNull(client, "client");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler");
  }

  /**
   * First connect (not retried: a failure here is surfaced to the caller), then keep the
   * connection up.
   */
  public void start(String address) throws IrcConnectionException {
    this.address = Objects.requireNonNull(address, "address");
    stopped.set(false);
    attempts.set(0);
    client.connect(address);
    watch(client.reconnectSignal());
  }

  /** Cancel any pending attempt and stop watching. Does not disconnect the client. */
  public void stop() {
    stopped.set(true);
    cancelPending();
  }

  @Override
  public void close() {
    stop();
  }

  /** Failed attempts since the last successful connect. */
  public long attempts() {
    return attempts.get();
  }

  private void watch(ReconnectSignal signal) {
    // A quit closes the signal, which completes this Maybe empty.
    Maybe.fromCallable(signal::take)
        .subscribeOn(Schedulers.io())
        .subscribe(
            lost -> scheduleReconnect(describe(lost)),
            err -> log.debug("[ircwire] Reconnect watch ended with error", err),
            () -> log.debug("[ircwire] Reconnect watch for {} closed without a loss", address));
  }

  private void scheduleReconnect(String reason) {
    if (stopped.get() || client.isShutDown()) return;
    if (!policy.enabled()) {
      log.info("[ircwire] Connection to {} lost ({}); automatic reconnect is disabled", address, reason);
      return;
    }

    long attempt = attempts.incrementAndGet();
    if (policy.maxAttempts() > 0 && attempt > policy.maxAttempts()) {
      log.error("[ircwire] Reconnect to {} aborted (max attempts {} reached)", address, policy.maxAttempts());
      return;
    }

    long delayMs = computeBackoffDelayMs(policy, attempt);
    log.info("[ircwire] Reconnecting to {} in {} ms (attempt {}, {})", address, delayMs, attempt, reason);

    Disposable next =
        Completable.timer(delayMs, TimeUnit.MILLISECONDS, timerScheduler)
            .andThen(Completable.fromAction(this::attemptReconnect))
            .subscribe(
                () -> {},
                err -> log.warn("[ircwire] Reconnect attempt to {} crashed", address, err));

    Disposable prev = pending.getAndSet(next);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }

  private void attemptReconnect() {
    if (stopped.get() || client.isShutDown()) return;
    try {
      client.connect(address);
    } catch (IrcConnectionException e) {
      log.warn("[ircwire] Reconnect attempt {} to {} failed: {}", attempts.get(), address, e.getMessage());
      scheduleReconnect("reconnect attempt failed");
      return;
    } catch (IllegalStateException e) {
      log.debug("[ircwire] Reconnect to {} abandoned: {}", address, e.getMessage());
      return;
    }
    attempts.set(0);
    watch(client.reconnectSignal());
  }

  private void cancelPending() {
    Disposable prev = pending.getAndSet(null);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }

  static long computeBackoffDelayMs(IrcProperties.Reconnect p, long attempt) {
    long base = p.initialDelayMs();
    double mult = Math.pow(p.multiplier(), Math.max(0, attempt - 1));
    double raw = base * mult;
    long capped = (long) Math.min(raw, (double) p.maxDelayMs());

    double jitter = p.jitterPct();
    if (jitter <= 0) return capped;

    double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
    long withJitter = (long) Math.max(0, capped * factor);
    return Math.max(250, withJitter);
  }

  private static String describe(SessionEnd.ConnectionLost lost) {
    Throwable cause = lost.cause();
    String detail = (cause == null || cause.getMessage() == null) ? "connection lost" : cause.getMessage();
    return lost.source() + " failed: " + detail;
  }
}
