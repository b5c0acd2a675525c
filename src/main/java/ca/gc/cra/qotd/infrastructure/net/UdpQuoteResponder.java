package ca.gc.cra.qotd.infrastructure.net;

import ca.gc.cra.qotd.application.broker.BrokerUnavailableException;
import ca.gc.cra.qotd.application.broker.QuoteBroker;
import ca.gc.cra.qotd.application.port.MetricsPort;
import ca.gc.cra.qotd.logging.Logs;
import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.SocketAddress;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Answers one received UDP datagram with one quote datagram.
 *
 * <p>Only quotes shorter than {@link #MAX_QUOTE_BYTES} fit the reply; longer ones are discarded and
 * another quote is requested until one fits. The retry is unbounded: a corpus holding only long
 * quotes never answers UDP clients, and the task ends only when the broker stops.</p>
 *
 * @since 0.1.0
 */
final class UdpQuoteResponder implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(UdpQuoteResponder.class);
  private static final int PREVIEW_BYTES = 64;

  /** Exclusive upper bound on the size of a quote sent over UDP. */
  static final int MAX_QUOTE_BYTES = 512;

  private final DatagramSocket socket;
  private final SocketAddress client;
  private final QuoteBroker broker;
  private final MetricsPort metrics;

  UdpQuoteResponder(DatagramSocket socket, SocketAddress client, QuoteBroker broker, MetricsPort metrics) {
    this.socket = Objects.requireNonNull(socket, "socket");
    this.client = Objects.requireNonNull(client, "client");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void run() {
    String address = Logs.address(client);
    MDC.put("transport", "udp");
    MDC.put("client", address);
    try {
      log.info("Received UDP request from {}", address);
      byte[] quote = nextFittingQuote();
      socket.send(new DatagramPacket(quote, quote.length, client));
      metrics.increment("qotd.udp.served");
      log.info("Served {} byte quote to UDP client {}", quote.length, address);
      if (log.isDebugEnabled()) {
        log.debug("Quote sent to {}: {}", address, Logs.preview(quote, PREVIEW_BYTES));
      }
    } catch (BrokerUnavailableException ex) {
      metrics.increment("qotd.udp.failed");
      log.warn("No quote available for UDP client {}: {}", address, ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("qotd.udp.failed");
      log.debug("Interrupted while serving UDP client {}", address);
    } catch (IOException ex) {
      metrics.increment("qotd.udp.failed");
      log.warn("Failed to send quote to UDP client {}", address, ex);
    } finally {
      MDC.remove("client");
      MDC.remove("transport");
    }
  }

  private byte[] nextFittingQuote() throws BrokerUnavailableException, InterruptedException {
    while (true) {
      byte[] quote = broker.request();
      if (quote.length < MAX_QUOTE_BYTES) {
        return quote;
      }
      metrics.increment("qotd.udp.oversize");
      log.debug("Quote of {} bytes does not fit a UDP reply; requesting another", quote.length);
    }
  }
}
