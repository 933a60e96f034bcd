package cafe.woden.huddle.util;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

/** Fallback shutdown hook for app-owned executors created via {@link NamedThreads}. */
@Component
@Lazy(false)
final class NamedThreadsLifecycle {
  private static final Logger log = LoggerFactory.getLogger(NamedThreadsLifecycle.class);

  @PreDestroy
  void shutdown() {
    int stopped = NamedThreads.shutdownTrackedExecutorsNow();
    if (stopped > 0) {
      log.debug("[huddle] stopped {} executor(s) still running at context close", stopped);
    }
  }
}
