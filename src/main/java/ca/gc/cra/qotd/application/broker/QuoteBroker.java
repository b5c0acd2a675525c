package ca.gc.cra.qotd.application.broker;

import ca.gc.cra.qotd.application.port.MetricsPort;
import ca.gc.cra.qotd.application.port.QuoteSource;
import ca.gc.cra.qotd.infrastructure.exec.ExecutorFactories;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Serializes all access to a {@link QuoteSource} through one worker thread.
 * <p><strong>Why:</strong> The corpus moves shared file positions on every read; a single owner makes
 * concurrent requests safe without locking the files.</p>
 * <p><strong>Role:</strong> Application service between connection handlers and the corpus.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Prepare one quote, wait for the next request, hand the quote over, repeat.</li>
 *   <li>Answer requests in arrival order through a bounded queue.</li>
 *   <li>Stop on the first source failure and reject all pending and later requests.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #submit()}, {@link #request()} and {@link #close()} are safe from
 * any thread. The source is touched only by the {@code qotd-broker} thread.</p>
 * <p><strong>Performance:</strong> At most one quote is prepared ahead of demand; submitters block while
 * the queue is full.</p>
 * <p><strong>Observability:</strong> Emits {@code qotd.broker.served}, {@code qotd.broker.failed},
 * {@code qotd.broker.waitNanos} and {@code qotd.quote.bytes}.</p>
 *
 * @since 0.1.0
 */
public final class QuoteBroker implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(QuoteBroker.class);

  /** Default number of requests that may wait for the worker. */
  public static final int DEFAULT_QUEUE_CAPACITY = 32;

  static final String WORKER_THREAD_NAME = "qotd-broker";

  private final QuoteSource source;
  private final MetricsPort metrics;
  private final BlockingQueue<PendingRequest> requests;
  private final List<Consumer<BrokerUnavailableException>> failureListeners = new ArrayList<>();
  private final AtomicReference<State> state = new AtomicReference<>(State.NEW);
  private final AtomicReference<BrokerUnavailableException> stopCause = new AtomicReference<>();

  private volatile Thread worker;

  /** Lifecycle of the worker. */
  public enum State {
    /** Created; worker not started. */
    NEW,
    /** Worker running and accepting requests. */
    RUNNING,
    /** Worker stopped by its source failing. */
    FAILED,
    /** Worker stopped by {@link #close()}. */
    CLOSED
  }

  /**
   * Creates a broker with the default queue capacity and no metrics.
   *
   * @param source quote source this broker will own while running
   */
  public QuoteBroker(QuoteSource source) {
    this(source, DEFAULT_QUEUE_CAPACITY, MetricsPort.NO_OP);
  }

  /**
   * Creates a broker.
   *
   * @param source quote source this broker will own while running; must not be {@code null}
   * @param queueCapacity maximum number of waiting requests; must be positive
   * @param metrics metrics sink; must not be {@code null}
   */
  public QuoteBroker(QuoteSource source, int queueCapacity, MetricsPort metrics) {
    this.source = Objects.requireNonNull(source, "source");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    this.requests = new ArrayBlockingQueue<>(queueCapacity);
  }

  /**
   * Registers a listener invoked once when the worker stops because its source failed.
   *
   * <p>Listeners run on the broker thread, or immediately on the caller's thread when the broker has
   * already failed. They are not invoked for {@link #close()}.</p>
   *
   * @param listener callback receiving the failure; must not be {@code null}
   */
  public void onFailure(Consumer<BrokerUnavailableException> listener) {
    Objects.requireNonNull(listener, "listener");
    BrokerUnavailableException failure;
    synchronized (failureListeners) {
      if (state.get() != State.FAILED) {
        failureListeners.add(listener);
        return;
      }
      failure = stopCause.get();
    }
    listener.accept(failure);
  }

  /**
   * Starts the worker thread.
   *
   * @throws IllegalStateException if the broker was already started or closed
   */
  public void start() {
    if (!state.compareAndSet(State.NEW, State.RUNNING)) {
      throw new IllegalStateException("Broker already started or closed (" + state.get() + ")");
    }
    Thread thread = ExecutorFactories.newThread(WORKER_THREAD_NAME, this::runLoop, true,
        (t, ex) -> log.error("Quote broker thread {} terminated unexpectedly", t.getName(), ex));
    worker = thread;
    thread.start();
    log.debug("Quote broker started with queue capacity {}", requests.remainingCapacity());
  }

  /**
   * Queues a request and returns its pending reply.
   *
   * <p>Blocks while the queue is full. Requests are answered in the order they are queued. A caller
   * that no longer wants the quote may cancel the returned future; the quote is then discarded.</p>
   *
   * @return future completed with the quote, or exceptionally with {@link BrokerUnavailableException}
   * @throws BrokerUnavailableException if the broker is not running
   * @throws InterruptedException if interrupted while waiting for queue space
   */
  public CompletableFuture<byte[]> submit() throws BrokerUnavailableException, InterruptedException {
    ensureRunning();
    PendingRequest request = new PendingRequest(new CompletableFuture<>(), System.nanoTime());
    requests.put(request);
    if (state.get() != State.RUNNING) {
      // Stopped while we were queueing; the worker's drain may already have run.
      rejectPending();
    }
    return request.reply();
  }

  /**
   * Requests one quote and waits for it.
   *
   * @return quote bytes
   * @throws BrokerUnavailableException if the broker is not running or stops before answering
   * @throws InterruptedException if interrupted while queueing or waiting; the pending reply is cancelled
   */
  public byte[] request() throws BrokerUnavailableException, InterruptedException {
    CompletableFuture<byte[]> reply = submit();
    try {
      return reply.get();
    } catch (InterruptedException ex) {
      reply.cancel(false);
      throw ex;
    } catch (ExecutionException ex) {
      if (ex.getCause() instanceof BrokerUnavailableException unavailable) {
        throw unavailable;
      }
      throw new BrokerUnavailableException("Quote broker failed to answer", ex.getCause());
    }
  }

  /**
   * Reports whether the worker is accepting requests.
   *
   * @return {@code true} while running
   */
  public boolean isRunning() {
    return state.get() == State.RUNNING;
  }

  /**
   * Returns the current lifecycle state.
   *
   * @return state snapshot
   */
  public State state() {
    return state.get();
  }

  /**
   * Returns the exception describing why the broker stopped.
   *
   * @return stop cause, empty while the broker is new or running
   */
  public Optional<BrokerUnavailableException> stopCause() {
    return Optional.ofNullable(stopCause.get());
  }

  /**
   * Stops the worker and rejects every pending request. The source is not closed.
   */
  @Override
  public void close() {
    State previous = state.getAndUpdate(s -> s == State.FAILED ? s : State.CLOSED);
    if (previous == State.CLOSED || previous == State.FAILED) {
      return;
    }
    stopCause.compareAndSet(null, new BrokerUnavailableException("Quote broker closed", null));
    Thread thread = worker;
    if (thread != null) {
      thread.interrupt();
    }
    rejectPending();
    log.debug("Quote broker closed");
  }

  private void runLoop() {
    try {
      while (!Thread.currentThread().isInterrupted()) {
        byte[] quote = source.randomQuote();
        PendingRequest request = requests.take();
        metrics.observe("qotd.broker.waitNanos", System.nanoTime() - request.enqueuedNanos());
        if (request.reply().complete(quote)) {
          metrics.increment("qotd.broker.served");
          metrics.observe("qotd.quote.bytes", quote.length);
        } else {
          log.debug("Requester abandoned its reply; discarding {} byte quote", quote.length);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Quote broker interrupted; stopping");
    } catch (IOException | RuntimeException ex) {
      fail(ex);
      return;
    }
    rejectPending();
  }

  private void fail(Exception cause) {
    BrokerUnavailableException failure =
        new BrokerUnavailableException("Quote source failed: " + cause.getMessage(), cause);
    List<Consumer<BrokerUnavailableException>> listeners;
    synchronized (failureListeners) {
      if (!state.compareAndSet(State.RUNNING, State.FAILED)) {
        log.debug("Quote source failed after broker was closed", cause);
        rejectPending();
        return;
      }
      stopCause.set(failure);
      listeners = new ArrayList<>(failureListeners);
      failureListeners.clear();
    }
    metrics.increment("qotd.broker.failed");
    log.error("Quote source failed; broker stopped and no further quotes will be served", cause);
    rejectPending();
    for (Consumer<BrokerUnavailableException> listener : listeners) {
      try {
        listener.accept(failure);
      } catch (RuntimeException listenerFailure) {
        log.warn("Broker failure listener threw", listenerFailure);
      }
    }
  }

  private void ensureRunning() throws BrokerUnavailableException {
    State current = state.get();
    if (current == State.RUNNING) {
      return;
    }
    BrokerUnavailableException cause = stopCause.get();
    if (cause != null) {
      throw new BrokerUnavailableException(cause.getMessage(), cause.getCause());
    }
    throw new BrokerUnavailableException("Quote broker is not running (" + current + ")", null);
  }

  private void rejectPending() {
    BrokerUnavailableException cause = stopCause.get();
    if (cause == null) {
      cause = new BrokerUnavailableException("Quote broker stopped", null);
    }
    PendingRequest pending;
    while ((pending = requests.poll()) != null) {
      pending.reply().completeExceptionally(cause);
    }
  }

  /** One queued request: its reply and the time it was queued. */
  private record PendingRequest(CompletableFuture<byte[]> reply, long enqueuedNanos) {}
}
