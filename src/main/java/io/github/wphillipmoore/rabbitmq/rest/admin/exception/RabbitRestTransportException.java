package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

import java.util.Objects;

/**
 * Thrown when a network, TLS or timeout failure prevents any response from being received.
 *
 * <p>Such failures may be transient. Retrying is left to the caller.
 */
public final class RabbitRestTransportException extends RabbitRestException {

  private static final long serialVersionUID = 1L;

  private final String url;

  /**
   * Creates a transport exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   */
  public RabbitRestTransportException(String message, String url) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a transport exception with a cause.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public RabbitRestTransportException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }
}
