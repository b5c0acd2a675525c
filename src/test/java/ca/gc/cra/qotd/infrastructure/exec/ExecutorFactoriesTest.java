package ca.gc.cra.qotd.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void connectionPoolRunsTasksOnNamedDaemonThreads() throws Exception {
    ExecutorService pool = ExecutorFactories.newConnectionPool("qotd-conn", null);
    try {
      Future<Thread> worker = pool.submit(Thread::currentThread);
      Thread thread = worker.get(5, TimeUnit.SECONDS);
      assertEquals("qotd-conn-0", thread.getName());
      assertTrue(thread.isDaemon());
    } finally {
      pool.shutdownNow();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void connectionPoolGrowsForConcurrentTasks() throws Exception {
    ExecutorService pool = ExecutorFactories.newConnectionPool("worker", null);
    CountDownLatch started = new CountDownLatch(3);
    CountDownLatch release = new CountDownLatch(1);
    try {
      for (int i = 0; i < 3; i++) {
        pool.execute(() -> {
          started.countDown();
          try {
            release.await(5, TimeUnit.SECONDS);
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
          }
        });
      }
      assertTrue(started.await(5, TimeUnit.SECONDS), "all tasks should run at once");
    } finally {
      release.countDown();
      pool.shutdown();
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService pool = ExecutorFactories.newConnectionPool(" ", null);
    try {
      Thread thread = pool.submit(Thread::currentThread).get(5, TimeUnit.SECONDS);
      assertTrue(thread.getName().startsWith("qotd-conn-"));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void newThreadAppliesNameDaemonFlagAndHandler() throws Exception {
    AtomicReference<Throwable> seen = new AtomicReference<>();
    CountDownLatch failed = new CountDownLatch(1);
    Thread thread = ExecutorFactories.newThread("qotd-broker", () -> {
      throw new IllegalStateException("boom");
    }, false, (t, ex) -> {
      seen.set(ex);
      failed.countDown();
    });

    assertEquals("qotd-broker", thread.getName());
    assertFalse(thread.isDaemon());
    thread.start();
    assertTrue(failed.await(5, TimeUnit.SECONDS));
    assertEquals("boom", seen.get().getMessage());
  }

  @Test
  void newThreadInstallsDefaultHandlerWhenNoneGiven() {
    Thread thread = ExecutorFactories.newThread("qotd-udp-receive", () -> { }, true, null);

    assertTrue(thread.isDaemon());
    assertFalse(thread.getUncaughtExceptionHandler() instanceof ThreadGroup);
  }

  @Test
  void newThreadRejectsBlankName() {
    assertThrows(IllegalArgumentException.class,
        () -> ExecutorFactories.newThread("  ", () -> { }, true, null));
    assertThrows(IllegalArgumentException.class,
        () -> ExecutorFactories.newThread(null, () -> { }, true, null));
  }
}
