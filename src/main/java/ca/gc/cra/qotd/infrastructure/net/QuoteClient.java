package ca.gc.cra.qotd.infrastructure.net;

import java.io.IOException;
import java.io.InputStream;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Arrays;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches one quote from an RFC 865 server.
 *
 * <p>TCP reads until the server closes the connection. UDP sends an empty datagram and accepts a
 * single reply of at most {@link #MAX_DATAGRAM_BYTES} bytes. Both are bounded by the configured
 * timeout.</p>
 *
 * @since 0.1.0
 */
public final class QuoteClient {
  private static final Logger log = LoggerFactory.getLogger(QuoteClient.class);

  /** Largest UDP reply accepted; longer datagrams are truncated by the socket. */
  public static final int MAX_DATAGRAM_BYTES = 512;

  private final Duration timeout;

  /**
   * Creates a client.
   *
   * @param timeout connect and receive timeout; must be positive
   */
  public QuoteClient(Duration timeout) {
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative() || timeout.toMillis() > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("timeout must be between 1ms and " + Integer.MAX_VALUE + "ms");
    }
  }

  /**
   * Connects over TCP and reads the quote until end of stream.
   *
   * @param server server address
   * @return raw quote bytes
   * @throws IOException if connecting or reading fails or times out
   */
  public byte[] fetchTcp(InetSocketAddress server) throws IOException {
    Objects.requireNonNull(server, "server");
    int timeoutMillis = (int) timeout.toMillis();
    try (Socket socket = new Socket()) {
      socket.connect(server, timeoutMillis);
      socket.setSoTimeout(timeoutMillis);
      log.debug("Connected to {} over TCP", server);
      InputStream in = socket.getInputStream();
      byte[] quote = in.readAllBytes();
      log.debug("Received {} bytes from {}", quote.length, server);
      return quote;
    }
  }

  /**
   * Sends an empty datagram and waits for one reply.
   *
   * @param server server address
   * @return raw quote bytes
   * @throws IOException if sending fails or no reply arrives within the timeout
   */
  public byte[] fetchUdp(InetSocketAddress server) throws IOException {
    Objects.requireNonNull(server, "server");
    try (DatagramSocket socket = new DatagramSocket()) {
      socket.setSoTimeout((int) timeout.toMillis());
      socket.send(new DatagramPacket(new byte[0], 0, server));
      log.debug("Sent UDP request to {}", server);
      byte[] buffer = new byte[MAX_DATAGRAM_BYTES];
      DatagramPacket reply = new DatagramPacket(buffer, buffer.length);
      socket.receive(reply);
      log.debug("Received {} bytes from {}", reply.getLength(), reply.getSocketAddress());
      return Arrays.copyOf(buffer, reply.getLength());
    }
  }
}
