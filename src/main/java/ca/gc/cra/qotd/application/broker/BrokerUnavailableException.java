package ca.gc.cra.qotd.application.broker;

/**
 * Signals that the quote broker has stopped and can no longer answer requests.
 *
 * <p>The cause, when present, is the failure that stopped the broker's worker. A broker stopped by
 * {@link QuoteBroker#close()} reports no cause.</p>
 *
 * @since 0.1.0
 */
public final class BrokerUnavailableException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates the exception.
   *
   * @param message detail message
   * @param cause failure that stopped the broker; may be {@code null}
   */
  public BrokerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
