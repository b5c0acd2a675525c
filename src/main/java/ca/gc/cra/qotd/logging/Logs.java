package ca.gc.cra.qotd.logging;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Logging hygiene helpers for quote previews and client addresses.
 * <p><strong>Why:</strong> Keeps long quotes from flooding debug logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#REPLACE} so non-UTF-8 quotes still render.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Renders up to {@code maxBytes} of a quote as a single log-friendly line.
   *
   * @param quote quote bytes; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to render; must be positive
   * @return preview with line breaks escaped, suffixed with the original length when truncated
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String preview(byte[] quote, int maxBytes) {
    if (quote == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    int shown = Math.min(quote.length, maxBytes);
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.REPLACE)
        .onUnmappableCharacter(CodingErrorAction.REPLACE);
    String text;
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(quote, 0, shown));
      text = buffer.toString();
    } catch (CharacterCodingException ex) {
      text = new String(quote, 0, shown, StandardCharsets.ISO_8859_1);
    }
    String escaped = text.replace("\r", "\\r").replace("\n", "\\n");
    return shown < quote.length
        ? escaped + "... (truncated, " + shown + " of " + quote.length + ")"
        : escaped;
  }

  /**
   * Formats a remote address as {@code host:port} without triggering reverse DNS.
   *
   * @param address socket address; may be {@code null}
   * @return printable address
   */
  public static String address(SocketAddress address) {
    if (address instanceof InetSocketAddress inet) {
      return inet.getHostString() + ":" + inet.getPort();
    }
    return address == null ? NULL_PLACEHOLDER : address.toString();
  }
}
