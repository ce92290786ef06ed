package cafe.woden.ircwire.irc;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-slot "the connection was lost" notification for one session.
 *
 * <p>The slot settles once: either a {@link SessionEnd.ConnectionLost} token is fired into it or it
 * is closed empty. Firing never blocks; a second fire is coalesced into the first. A consumer gets
 * the token at most once and afterwards observes closure ({@code null} / empty) immediately.
 */
public final class ReconnectSignal {

  private final AtomicBoolean settled = new AtomicBoolean(false);
  private final AtomicReference<SessionEnd.ConnectionLost> pending = new AtomicReference<>();
  private final CountDownLatch latch = new CountDownLatch(1);

  /** @return true if this call delivered the token, false if it was coalesced or the slot closed */
  public boolean fire(SessionEnd.ConnectionLost token) {
    Objects.requireNonNull(token, "token");
    if (!settled.compareAndSet(false, true)) return false;
    pending.set(token);
    latch.countDown();
    return true;
  }

  /** Close without a token. No-op when already fired or closed. */
  public void close() {
    if (settled.compareAndSet(false, true)) latch.countDown();
  }

  /**
   * Block until the slot settles.
   *
   * @return the token for the first consumer, {@code null} once drained or when closed empty
   */
  public SessionEnd.ConnectionLost take() throws InterruptedException {
    latch.await();
    return pending.getAndSet(null);
  }

  /** Like {@link #take()} but bounded; empty on timeout, drain or closure. */
  public Optional<SessionEnd.ConnectionLost> poll(Duration timeout) throws InterruptedException {
    if (!latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS)) return Optional.empty();
    return Optional.ofNullable(pending.getAndSet(null));
  }

  /** Fired or closed. */
  public boolean isSettled() {
    return settled.get();
  }

  /** A token is waiting to be taken. */
  public boolean isPending() {
    return pending.get() != null;
  }
}
