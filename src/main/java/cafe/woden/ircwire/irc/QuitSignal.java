package cafe.woden.ircwire.irc;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/** Broadcast shutdown latch. Fires at most once; later triggers are no-ops. */
public final class QuitSignal {

  private final AtomicBoolean fired = new AtomicBoolean(false);
  private final CountDownLatch latch = new CountDownLatch(1);

  /** @return true only for the call that actually fired the signal */
  public boolean trigger() {
    if (!fired.compareAndSet(false, true)) return false;
    latch.countDown();
    return true;
  }

  public boolean isTriggered() {
    return fired.get();
  }

  public boolean await(Duration timeout) throws InterruptedException {
    return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}
