package ca.gc.cra.qotd.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.qotd.application.broker.BrokerUnavailableException;
import ca.gc.cra.qotd.application.port.QuoteSource;
import ca.gc.cra.qotd.testutil.QuoteFixtures;
import ca.gc.cra.qotd.testutil.RecordingMetricsPort;
import ca.gc.cra.qotd.testutil.ScriptedQuoteSource;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class QuoteServerTest {
  private static final InetSocketAddress LOOPBACK = new InetSocketAddress("127.0.0.1", 0);

  private ExecutorService runner;
  private QuoteServer server;
  private RecordingMetricsPort metrics;
  private final QuoteClient client = new QuoteClient(Duration.ofSeconds(5));

  @BeforeEach
  void setUp() {
    runner = Executors.newCachedThreadPool();
    metrics = new RecordingMetricsPort();
    server = new QuoteServer(8, metrics);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    server.close();
    runner.shutdownNow();
    assertTrue(runner.awaitTermination(5, TimeUnit.SECONDS));
  }

  @Test
  void tcpClientReceivesOneQuoteThenEndOfStream() throws Exception {
    start(ScriptedQuoteSource.repeating("Fortune favours the bold.\n"));

    byte[] quote = client.fetchTcp(server.localAddress());

    assertEquals("Fortune favours the bold.\n", QuoteFixtures.utf8(quote));
  }

  @Test
  void udpClientReceivesOneDatagram() throws Exception {
    start(ScriptedQuoteSource.repeating("Short and sweet.\n"));

    byte[] quote = client.fetchUdp(server.localAddress());

    assertEquals("Short and sweet.\n", QuoteFixtures.utf8(quote));
  }

  @Test
  void tcpAndUdpShareTheEphemeralPort() throws Exception {
    server.bind(LOOPBACK);

    InetSocketAddress bound = server.localAddress();

    assertNotEquals(0, bound.getPort());
    assertEquals(QuoteServer.State.BOUND, server.state());
    assertThrows(SocketException.class, () -> new DatagramSocket(bound).close());
  }

  @Test
  void udpSkipsQuotesThatDoNotFitOneDatagram() throws Exception {
    String huge = "x".repeat(600);
    String exactLimit = "y".repeat(UdpQuoteResponder.MAX_QUOTE_BYTES);
    String fits = "z".repeat(UdpQuoteResponder.MAX_QUOTE_BYTES - 1);
    start(ScriptedQuoteSource.repeating(huge, exactLimit, fits));

    byte[] quote = client.fetchUdp(server.localAddress());

    assertEquals(fits, QuoteFixtures.utf8(quote));
    assertEquals(2, metrics.count("qotd.udp.oversize"));
  }

  @Test
  void debugLogShowsEscapedQuotePreview() throws Exception {
    Logger logger = (Logger) LoggerFactory.getLogger(TcpQuoteResponder.class);
    Level originalLevel = logger.getLevel();
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    logger.setLevel(Level.DEBUG);
    try {
      start(ScriptedQuoteSource.repeating("first line\nsecond line\n" + "z".repeat(100)));

      client.fetchTcp(server.localAddress());

      long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
      while (previews(appender).isEmpty() && System.nanoTime() < deadline) {
        Thread.onSpinWait();
      }
      List<String> previews = previews(appender);
      assertEquals(1, previews.size());
      assertTrue(previews.get(0).contains("first line\\nsecond line\\n"), previews.get(0));
      assertTrue(previews.get(0).endsWith("... (truncated, 64 of 123)"), previews.get(0));
    } finally {
      logger.detachAppender(appender);
      logger.setLevel(originalLevel);
    }
  }

  private static List<String> previews(ListAppender<ILoggingEvent> appender) {
    List<ILoggingEvent> events;
    synchronized (appender) {
      events = new ArrayList<>(appender.list);
    }
    List<String> messages = new ArrayList<>();
    for (ILoggingEvent event : events) {
      if (event.getLevel() == Level.DEBUG && event.getFormattedMessage().startsWith("Quote sent to")) {
        messages.add(event.getFormattedMessage());
      }
    }
    return messages;
  }

  @Test
  void tcpServesOversizeQuotesWhole() throws Exception {
    String huge = "w".repeat(4096);
    start(ScriptedQuoteSource.repeating(huge));

    assertEquals(huge, QuoteFixtures.utf8(client.fetchTcp(server.localAddress())));
  }

  @Test
  void servesConcurrentClients() throws Exception {
    start(ScriptedQuoteSource.repeating("q\n"));
    InetSocketAddress address = server.localAddress();
    List<Future<byte[]>> fetches = new ArrayList<>();

    for (int i = 0; i < 20; i++) {
      boolean tcp = i % 2 == 0;
      fetches.add(runner.submit(() -> tcp ? client.fetchTcp(address) : client.fetchUdp(address)));
    }

    for (Future<byte[]> fetch : fetches) {
      assertEquals("q\n", QuoteFixtures.utf8(fetch.get(10, TimeUnit.SECONDS)));
    }
    assertEquals(10, metrics.count("qotd.tcp.accepted"));
    assertEquals(10, metrics.count("qotd.udp.received"));
  }

  @Test
  void closeEndsServeNormallyAndLeavesSourceOpen() throws Exception {
    ScriptedQuoteSource source = ScriptedQuoteSource.repeating("q");
    Future<Void> serving = start(source);

    server.close();

    serving.get(5, TimeUnit.SECONDS);
    assertEquals(QuoteServer.State.CLOSED, server.state());
    assertFalse(source.closed());
  }

  @Test
  void brokerFailureStopsServingAndSurfacesFromServe() throws Exception {
    Future<Void> serving = start(ScriptedQuoteSource.failingAfter(1, "last words\n"));
    InetSocketAddress address = server.localAddress();

    assertEquals("last words\n", QuoteFixtures.utf8(client.fetchTcp(address)));

    ExecutionException ex = assertThrows(ExecutionException.class, () -> serving.get(5, TimeUnit.SECONDS));
    assertInstanceOf(BrokerUnavailableException.class, ex.getCause());
    assertEquals(QuoteServer.State.CLOSED, server.state());
    assertThrows(IOException.class, () -> client.fetchTcp(address));
  }

  @Test
  void bindingAnOccupiedPortFailsWithoutLeakingSockets() throws Exception {
    server.bind(LOOPBACK);
    QuoteServer second = new QuoteServer();

    assertThrows(IOException.class, () -> second.bind(server.localAddress()));
    assertEquals(QuoteServer.State.UNBOUND, second.state());
    second.close();
  }

  @Test
  void serveRequiresBinding() {
    assertThrows(IllegalStateException.class, () -> server.serve(ScriptedQuoteSource.repeating("q")));
  }

  private Future<Void> start(QuoteSource source) throws IOException {
    server.bind(LOOPBACK);
    return runner.submit(() -> {
      server.serve(source);
      return null;
    });
  }
}
