package cafe.woden.huddle.config;

import cafe.woden.huddle.util.NamedThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors and the RxJava schedulers built on them.
 *
 * <p>Topic owners and sessions each take a {@link Scheduler.Worker} from their scheduler. A worker
 * runs its tasks one at a time in submission order, which is what makes every topic and every
 * session a serialized owner of its state while sharing a small pool of threads.
 */
@Configuration
public class ExecutorConfig {
  public static final String TOPIC_INBOX_EXECUTOR = "topicInboxExecutor";
  public static final String SESSION_EXECUTOR = "sessionExecutor";
  public static final String STORE_TIMEOUT_EXECUTOR = "storeTimeoutExecutor";

  public static final String TOPIC_SCHEDULER = "topicScheduler";
  public static final String SESSION_SCHEDULER = "sessionScheduler";
  public static final String STORE_TIMEOUT_SCHEDULER = "storeTimeoutScheduler";

  private static final int TOPIC_THREADS = Math.max(2, Runtime.getRuntime().availableProcessors());

  @Bean(name = TOPIC_INBOX_EXECUTOR, destroyMethod = "shutdownNow")
  public ScheduledExecutorService topicInboxExecutor() {
    return NamedThreads.newScheduledThreadPool(TOPIC_THREADS, "huddle-topic");
  }

  @Bean(name = SESSION_EXECUTOR, destroyMethod = "shutdownNow")
  public ExecutorService sessionExecutor() {
    return NamedThreads.newCachedThreadPool("huddle-session");
  }

  @Bean(name = STORE_TIMEOUT_EXECUTOR, destroyMethod = "shutdownNow")
  public ScheduledExecutorService storeTimeoutExecutor() {
    return NamedThreads.newSingleThreadScheduledExecutor("huddle-store-timeout");
  }

  @Bean(name = TOPIC_SCHEDULER)
  public Scheduler topicScheduler(
      @Qualifier(TOPIC_INBOX_EXECUTOR) ScheduledExecutorService topicInboxExecutor) {
    return Schedulers.from(topicInboxExecutor, false, true);
  }

  @Bean(name = SESSION_SCHEDULER)
  public Scheduler sessionScheduler(@Qualifier(SESSION_EXECUTOR) ExecutorService sessionExecutor) {
    return Schedulers.from(sessionExecutor, false, true);
  }

  @Bean(name = STORE_TIMEOUT_SCHEDULER)
  public Scheduler storeTimeoutScheduler(
      @Qualifier(STORE_TIMEOUT_EXECUTOR) ScheduledExecutorService storeTimeoutExecutor) {
    return Schedulers.from(storeTimeoutExecutor);
  }
}
