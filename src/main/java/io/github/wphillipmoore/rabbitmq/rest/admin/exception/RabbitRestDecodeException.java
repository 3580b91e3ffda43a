package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

import java.util.Objects;

/**
 * Thrown when a success response carries a body that cannot be decoded into the expected shape.
 *
 * <p>Usually points at a version mismatch between the client and the broker's management plugin.
 */
public final class RabbitRestDecodeException extends RabbitRestException {

  private static final long serialVersionUID = 1L;

  private final String url;
  private final String responseText;

  /**
   * Creates a decode exception.
   *
   * @param message description of the failure
   * @param url the URL the response came from
   * @param responseText the raw response text, never null
   */
  public RabbitRestDecodeException(String message, String url, String responseText) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
    this.responseText = Objects.requireNonNull(responseText, "responseText");
  }

  /**
   * Creates a decode exception with a cause.
   *
   * @param message description of the failure
   * @param url the URL the response came from
   * @param responseText the raw response text, never null
   * @param cause the underlying parse failure
   */
  public RabbitRestDecodeException(
      String message, String url, String responseText, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
    this.responseText = Objects.requireNonNull(responseText, "responseText");
  }

  /** Returns the URL the undecodable response came from. */
  public String getUrl() {
    return url;
  }

  /** Returns the raw response text. */
  public String getResponseText() {
    return responseText;
  }
}
