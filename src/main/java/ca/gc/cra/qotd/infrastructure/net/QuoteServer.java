package ca.gc.cra.qotd.infrastructure.net;

import ca.gc.cra.qotd.application.broker.BrokerUnavailableException;
import ca.gc.cra.qotd.application.broker.QuoteBroker;
import ca.gc.cra.qotd.application.port.MetricsPort;
import ca.gc.cra.qotd.application.port.QuoteEndpoint;
import ca.gc.cra.qotd.application.port.QuoteSource;
import ca.gc.cra.qotd.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.qotd.logging.Logs;
import java.io.IOException;
import java.lang.Thread.UncaughtExceptionHandler;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> RFC 865 server answering TCP connections and UDP datagrams on one address.
 * <p><strong>Why:</strong> Both transports share a single broker so every client, whatever the protocol,
 * draws from the same corpus through one reader.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link QuoteEndpoint}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Bind a TCP listener, then a UDP socket on the TCP listener's resolved address.</li>
 *   <li>Run one accept thread and one receive thread that hand each client to a connection pool.</li>
 *   <li>Stop accepting work when the broker fails, and report the failure from {@link #serve(QuoteSource)}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> {@link #close()} may be called from any thread; {@link #bind} and
 * {@link #serve} are called once each by the owning thread.</p>
 * <p><strong>Performance:</strong> One pooled thread per in-flight client; no timeouts on client I/O.</p>
 * <p><strong>Observability:</strong> Emits {@code qotd.tcp.*} and {@code qotd.udp.*} counters; handler logs carry
 * MDC keys {@code transport} and {@code client}.</p>
 *
 * @since 0.1.0
 */
public final class QuoteServer implements QuoteEndpoint {
  private static final Logger log = LoggerFactory.getLogger(QuoteServer.class);

  static final String TCP_THREAD_NAME = "qotd-tcp-accept";
  static final String UDP_THREAD_NAME = "qotd-udp-receive";
  static final String CONNECTION_THREAD_PREFIX = "qotd-conn";

  // Request content is ignored; the buffer only needs to accept the datagram.
  private static final int RECEIVE_BUFFER_BYTES = 512;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(2);

  /** Lifecycle of the server. */
  public enum State {
    /** Created; no sockets open. */
    UNBOUND,
    /** Sockets bound; not yet serving. */
    BOUND,
    /** Accepting and answering clients. */
    SERVING,
    /** Sockets closed; terminal. */
    CLOSED
  }

  private final int brokerQueueCapacity;
  private final MetricsPort metrics;
  private final AtomicReference<State> state = new AtomicReference<>(State.UNBOUND);
  private final AtomicReference<BrokerUnavailableException> brokerFailure = new AtomicReference<>();
  private final CountDownLatch stopped = new CountDownLatch(1);
  private final UncaughtExceptionHandler uncaughtHandler =
      (thread, ex) -> log.error("Server thread {} terminated unexpectedly", thread.getName(), ex);

  private volatile ServerSocket tcp;
  private volatile DatagramSocket udp;
  private volatile InetSocketAddress localAddress;
  private volatile QuoteBroker broker;
  private volatile ExecutorService connections;

  /**
   * Creates a server with the default broker queue capacity and no metrics.
   */
  public QuoteServer() {
    this(QuoteBroker.DEFAULT_QUEUE_CAPACITY, MetricsPort.NO_OP);
  }

  /**
   * Creates a server.
   *
   * @param brokerQueueCapacity number of client requests that may wait for the broker; must be positive
   * @param metrics metrics sink; must not be {@code null}
   */
  public QuoteServer(int brokerQueueCapacity, MetricsPort metrics) {
    if (brokerQueueCapacity <= 0) {
      throw new IllegalArgumentException("brokerQueueCapacity must be positive");
    }
    this.brokerQueueCapacity = brokerQueueCapacity;
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Binds the TCP listener, then the UDP socket on the same resolved address.
   *
   * @param address bind address; port {@code 0} selects one ephemeral port shared by both transports
   * @throws IOException if either socket fails to bind; nothing is left open
   * @throws IllegalStateException if the server is not {@link State#UNBOUND}
   */
  @Override
  public void bind(InetSocketAddress address) throws IOException {
    Objects.requireNonNull(address, "address");
    if (state.get() != State.UNBOUND) {
      throw new IllegalStateException("Server cannot bind in state " + state.get());
    }
    ServerSocket server = new ServerSocket();
    DatagramSocket datagram;
    InetSocketAddress resolved;
    try {
      server.setReuseAddress(true);
      server.bind(address);
      resolved = (InetSocketAddress) server.getLocalSocketAddress();
      datagram = new DatagramSocket(resolved);
    } catch (IOException | RuntimeException ex) {
      closeAfterFailure(server, ex);
      throw ex;
    }
    tcp = server;
    udp = datagram;
    localAddress = resolved;
    if (!state.compareAndSet(State.UNBOUND, State.BOUND)) {
      closeSockets();
      throw new IllegalStateException("Server was closed while binding");
    }
    log.debug("Bound TCP and UDP sockets to {}", Logs.address(resolved));
  }

  @Override
  public InetSocketAddress localAddress() {
    InetSocketAddress bound = localAddress;
    if (bound == null) {
      throw new IllegalStateException("Server is not bound");
    }
    return bound;
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
   * Serves quotes from {@code source} until {@link #close()} is called or the broker fails.
   *
   * <p>The source is read only by the broker thread. On return the sockets, the connection pool
   * and the broker are shut down; the source itself is left open for its owner to close.</p>
   *
   * @param source quote source; must not be {@code null}
   * @throws BrokerUnavailableException if the source failed and the server stopped because of it
   * @throws InterruptedException if the calling thread is interrupted; the server is closed first
   * @throws IllegalStateException if the server is not {@link State#BOUND}
   */
  @Override
  public void serve(QuoteSource source) throws BrokerUnavailableException, InterruptedException {
    Objects.requireNonNull(source, "source");
    if (!state.compareAndSet(State.BOUND, State.SERVING)) {
      throw new IllegalStateException("Server cannot serve in state " + state.get());
    }
    QuoteBroker quoteBroker = new QuoteBroker(source, brokerQueueCapacity, metrics);
    broker = quoteBroker;
    connections = ExecutorFactories.newConnectionPool(CONNECTION_THREAD_PREFIX, uncaughtHandler);
    quoteBroker.onFailure(this::brokerFailed);
    try {
      quoteBroker.start();
      ExecutorFactories.newThread(TCP_THREAD_NAME, this::acceptLoop, true, uncaughtHandler).start();
      ExecutorFactories.newThread(UDP_THREAD_NAME, this::receiveLoop, true, uncaughtHandler).start();
      stopped.await();
    } finally {
      state.set(State.CLOSED);
      release();
    }
    BrokerUnavailableException failure = brokerFailure.get();
    if (failure != null) {
      throw failure;
    }
    log.info("Server on {} stopped", Logs.address(localAddress));
  }

  /**
   * Stops accepting clients and closes both sockets. A blocked {@link #serve(QuoteSource)} returns.
   */
  @Override
  public void close() {
    State previous = state.getAndSet(State.CLOSED);
    if (previous == State.CLOSED) {
      return;
    }
    closeSockets();
    stopped.countDown();
  }

  private void brokerFailed(BrokerUnavailableException failure) {
    brokerFailure.compareAndSet(null, failure);
    log.error("Quote broker stopped; closing listeners on {}", Logs.address(localAddress));
    state.set(State.CLOSED);
    closeSockets();
    stopped.countDown();
  }

  private void acceptLoop() {
    ServerSocket server = tcp;
    while (!server.isClosed()) {
      Socket socket;
      try {
        socket = server.accept();
      } catch (IOException ex) {
        if (server.isClosed()) {
          break;
        }
        metrics.increment("qotd.tcp.failed");
        log.warn("TCP accept failed on {}", Logs.address(localAddress), ex);
        continue;
      }
      metrics.increment("qotd.tcp.accepted");
      if (!dispatch(new TcpQuoteResponder(socket, broker, metrics))) {
        closeRejected(socket);
      }
    }
    log.debug("TCP accept loop on {} stopped", Logs.address(localAddress));
  }

  private void receiveLoop() {
    DatagramSocket socket = udp;
    byte[] buffer = new byte[RECEIVE_BUFFER_BYTES];
    while (!socket.isClosed()) {
      DatagramPacket packet = new DatagramPacket(buffer, buffer.length);
      try {
        socket.receive(packet);
      } catch (IOException ex) {
        if (socket.isClosed()) {
          break;
        }
        metrics.increment("qotd.udp.failed");
        log.warn("UDP receive failed on {}", Logs.address(localAddress), ex);
        continue;
      }
      metrics.increment("qotd.udp.received");
      dispatch(new UdpQuoteResponder(socket, packet.getSocketAddress(), broker, metrics));
    }
    log.debug("UDP receive loop on {} stopped", Logs.address(localAddress));
  }

  private boolean dispatch(Runnable task) {
    try {
      connections.execute(task);
      return true;
    } catch (RejectedExecutionException ex) {
      log.debug("Server shutting down; dropping client task", ex);
      return false;
    }
  }

  private void closeRejected(Socket socket) {
    try {
      socket.close();
    } catch (IOException ex) {
      log.debug("Failed to close rejected TCP connection", ex);
    }
  }

  private void release() throws InterruptedException {
    closeSockets();
    QuoteBroker quoteBroker = broker;
    if (quoteBroker != null) {
      quoteBroker.close();
    }
    ExecutorService pool = connections;
    if (pool == null) {
      return;
    }
    pool.shutdown();
    try {
      if (!pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Connection tasks still running after {}; interrupting", SHUTDOWN_TIMEOUT);
        pool.shutdownNow();
      }
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      throw ex;
    }
  }

  private void closeSockets() {
    ServerSocket server = tcp;
    if (server != null) {
      try {
        server.close();
      } catch (IOException ex) {
        log.warn("Failed to close TCP listener", ex);
      }
    }
    DatagramSocket datagram = udp;
    if (datagram != null) {
      datagram.close();
    }
  }

  private static void closeAfterFailure(ServerSocket server, Exception primary) {
    try {
      server.close();
    } catch (IOException closeFailure) {
      primary.addSuppressed(closeFailure);
    }
  }
}
