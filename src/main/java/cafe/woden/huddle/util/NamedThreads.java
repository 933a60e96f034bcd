package cafe.woden.huddle.util;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Shared helpers for creating app-owned executors on named daemon threads. */
public final class NamedThreads {
  private static final Logger log = LoggerFactory.getLogger(NamedThreads.class);

  private static final Set<ExecutorService> TRACKED_EXECUTORS = ConcurrentHashMap.newKeySet();

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName) {
    String base = normalize(baseName);
    AtomicInteger counter = new AtomicInteger();
    return task -> {
      Thread t = new Thread(task, base + "-" + counter.incrementAndGet());
      t.setDaemon(true);
      t.setUncaughtExceptionHandler(
          (thread, err) -> log.error("[huddle] uncaught failure on {}", thread.getName(), err));
      return t;
    };
  }

  public static ExecutorService newCachedThreadPool(String baseName) {
    return track(Executors.newCachedThreadPool(namedFactory(baseName)));
  }

  public static ScheduledExecutorService newScheduledThreadPool(int poolSize, String baseName) {
    int size = Math.max(1, poolSize);
    return track(Executors.newScheduledThreadPool(size, namedFactory(baseName)));
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return track(Executors.newSingleThreadScheduledExecutor(namedFactory(baseName)));
  }

  /** Shuts down every tracked executor that is still running. Returns how many were stopped. */
  public static int shutdownTrackedExecutorsNow() {
    int count = 0;
    for (ExecutorService exec : List.copyOf(TRACKED_EXECUTORS)) {
      if (exec == null) continue;
      if (exec.isShutdown() || exec.isTerminated()) continue;
      exec.shutdownNow();
      count++;
    }
    TRACKED_EXECUTORS.clear();
    return count;
  }

  private static <E extends ExecutorService> E track(E exec) {
    TRACKED_EXECUTORS.removeIf(e -> e == null || e.isShutdown() || e.isTerminated());
    TRACKED_EXECUTORS.add(exec);
    return exec;
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "huddle-thread" : s;
  }
}
