package ca.gc.cra.qotd.infrastructure.net;

import ca.gc.cra.qotd.application.broker.BrokerUnavailableException;
import ca.gc.cra.qotd.application.broker.QuoteBroker;
import ca.gc.cra.qotd.application.port.MetricsPort;
import ca.gc.cra.qotd.logging.Logs;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Answers one accepted TCP connection: writes a single quote and closes the socket. Anything the
 * client sends is ignored.
 *
 * @since 0.1.0
 */
final class TcpQuoteResponder implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(TcpQuoteResponder.class);
  private static final int PREVIEW_BYTES = 64;

  private final Socket socket;
  private final QuoteBroker broker;
  private final MetricsPort metrics;

  TcpQuoteResponder(Socket socket, QuoteBroker broker, MetricsPort metrics) {
    this.socket = Objects.requireNonNull(socket, "socket");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void run() {
    String client = Logs.address(socket.getRemoteSocketAddress());
    MDC.put("transport", "tcp");
    MDC.put("client", client);
    try (Socket s = socket) {
      log.info("Accepted TCP client {}", client);
      byte[] quote = broker.request();
      OutputStream out = s.getOutputStream();
      out.write(quote);
      out.flush();
      s.shutdownOutput();
      metrics.increment("qotd.tcp.served");
      log.info("Served {} byte quote to TCP client {}", quote.length, client);
      if (log.isDebugEnabled()) {
        log.debug("Quote sent to {}: {}", client, Logs.preview(quote, PREVIEW_BYTES));
      }
    } catch (BrokerUnavailableException ex) {
      metrics.increment("qotd.tcp.failed");
      log.warn("No quote available for TCP client {}: {}", client, ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      metrics.increment("qotd.tcp.failed");
      log.debug("Interrupted while serving TCP client {}", client);
    } catch (IOException ex) {
      metrics.increment("qotd.tcp.failed");
      log.warn("Failed to serve TCP client {}", client, ex);
    } finally {
      MDC.remove("client");
      MDC.remove("transport");
    }
  }
}
