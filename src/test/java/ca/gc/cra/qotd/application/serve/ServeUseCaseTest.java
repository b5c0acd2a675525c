package ca.gc.cra.qotd.application.serve;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.qotd.application.broker.BrokerUnavailableException;
import ca.gc.cra.qotd.application.port.QuoteEndpoint;
import ca.gc.cra.qotd.application.port.QuoteSource;
import ca.gc.cra.qotd.testutil.ScriptedQuoteSource;
import java.io.IOException;
import java.net.BindException;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ServeUseCaseTest {
  private static final InetSocketAddress ADDRESS = new InetSocketAddress("127.0.0.1", 0);

  @Test
  void indexesBeforeBindingThenServesAndReleases() throws Exception {
    ScriptedQuoteSource source = ScriptedQuoteSource.repeating("q");
    RecordingEndpoint endpoint = new RecordingEndpoint();
    List<String> calls = endpoint.calls;

    new ServeUseCase(() -> {
      calls.add("open");
      return source;
    }, endpoint, ADDRESS).run();

    assertEquals(List.of("open", "bind", "serve", "close"), calls);
    assertSame(source, endpoint.served);
    assertTrue(source.closed());
  }

  @Test
  void sourceFailureAbortsBeforeBinding() {
    RecordingEndpoint endpoint = new RecordingEndpoint();

    IOException ex = assertThrows(IOException.class, () -> new ServeUseCase(() -> {
      throw new IOException("unreadable corpus");
    }, endpoint, ADDRESS).run());

    assertEquals("unreadable corpus", ex.getMessage());
    assertTrue(endpoint.calls.isEmpty());
  }

  @Test
  void bindFailureClosesEndpointAndSource() {
    ScriptedQuoteSource source = ScriptedQuoteSource.repeating("q");
    RecordingEndpoint endpoint = new RecordingEndpoint();
    endpoint.bindFailure = new BindException("Address already in use");

    assertThrows(BindException.class, () -> new ServeUseCase(() -> source, endpoint, ADDRESS).run());

    assertEquals(List.of("bind", "close"), endpoint.calls);
    assertTrue(source.closed());
  }

  @Test
  void brokerFailurePropagatesAfterRelease() {
    ScriptedQuoteSource source = ScriptedQuoteSource.repeating("q");
    RecordingEndpoint endpoint = new RecordingEndpoint();
    endpoint.serveFailure = new BrokerUnavailableException("Quote source failed", new IOException("gone"));

    BrokerUnavailableException ex = assertThrows(BrokerUnavailableException.class,
        () -> new ServeUseCase(() -> source, endpoint, ADDRESS).run());

    assertSame(endpoint.serveFailure, ex);
    assertEquals(List.of("bind", "serve", "close"), endpoint.calls);
    assertTrue(source.closed());
  }

  @Test
  void stopClosesEndpoint() {
    RecordingEndpoint endpoint = new RecordingEndpoint();

    new ServeUseCase(() -> ScriptedQuoteSource.repeating("q"), endpoint, ADDRESS).stop();

    assertEquals(List.of("close"), endpoint.calls);
  }

  private static final class RecordingEndpoint implements QuoteEndpoint {
    final List<String> calls = new ArrayList<>();
    IOException bindFailure;
    BrokerUnavailableException serveFailure;
    QuoteSource served;

    @Override
    public void bind(InetSocketAddress address) throws IOException {
      calls.add("bind");
      if (bindFailure != null) {
        throw bindFailure;
      }
    }

    @Override
    public InetSocketAddress localAddress() {
      return new InetSocketAddress("127.0.0.1", 1717);
    }

    @Override
    public void serve(QuoteSource source) throws BrokerUnavailableException {
      calls.add("serve");
      served = source;
      if (serveFailure != null) {
        throw serveFailure;
      }
    }

    @Override
    public void close() {
      calls.add("close");
    }
  }
}
