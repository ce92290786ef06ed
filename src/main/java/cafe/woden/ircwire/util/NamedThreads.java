package cafe.woden.ircwire.util;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicLong;

/** Shared helpers for creating named daemon threads and the executors built on them. */
public final class NamedThreads {

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicLong seq = new AtomicLong();
    return r -> {
      Thread t = new Thread(r, base + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return Executors.newSingleThreadScheduledExecutor(namedFactory(baseName));
  }

  public static Thread unstarted(String name, Runnable task) {
    Thread t = new Thread(task, normalize(name));
    t.setDaemon(true);
    return t;
  }

  public static Thread start(String name, Runnable task) {
    Thread t = unstarted(name, task);
    t.start();
    return t;
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "ircwire-thread" : s;
  }
}
