package ca.gc.cra.qotd.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named threads and pools used by the quote service.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final long CONNECTION_KEEP_ALIVE_SECONDS = 60L;

  private ExecutorFactories() {}

  /**
   * Builds an unbounded cached executor for per-connection tasks.
   *
   * <p>Each accepted TCP connection and received UDP datagram runs on its own task, so a slow client
   * never delays another. Idle threads are reclaimed after a minute.</p>
   *
   * @param prefix thread-name prefix used to tag worker threads (e.g., {@code qotd-conn})
   * @param handler uncaught exception handler installed on each worker thread; {@code null} logs failures at ERROR
   * @return configured executor service
   */
  public static ExecutorService newConnectionPool(String prefix, UncaughtExceptionHandler handler) {
    ThreadFactory factory = namedThreadFactory(
        (prefix == null || prefix.isBlank()) ? "qotd-conn" : prefix, true, handler);
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        CONNECTION_KEEP_ALIVE_SECONDS,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates (but does not start) a dedicated thread.
   *
   * @param name thread name; must not be blank
   * @param task body to run
   * @param daemon whether the thread should not keep the JVM alive
   * @param handler uncaught exception handler; {@code null} logs failures at ERROR
   * @return unstarted thread
   */
  public static Thread newThread(
      String name, Runnable task, boolean daemon, UncaughtExceptionHandler handler) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    Thread thread = new Thread(Objects.requireNonNull(task, "task"), name);
    thread.setDaemon(daemon);
    thread.setUncaughtExceptionHandler(Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Thread {} terminated unexpectedly", t.getName(), ex)));
    return thread;
  }

  private static ThreadFactory namedThreadFactory(
      String prefix, boolean daemon, UncaughtExceptionHandler handler) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> newThread(prefix + "-" + index.getAndIncrement(), runnable, daemon, handler);
  }
}
