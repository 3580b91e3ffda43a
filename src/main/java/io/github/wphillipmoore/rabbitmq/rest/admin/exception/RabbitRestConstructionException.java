package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

/**
 * Thrown when a client configuration or resource path cannot form a valid request URL.
 *
 * <p>The request can never succeed without correcting the input.
 */
public final class RabbitRestConstructionException extends RabbitRestException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a construction exception.
   *
   * @param message description of the failure
   */
  public RabbitRestConstructionException(String message) {
    super(message);
  }

  /**
   * Creates a construction exception with a cause.
   *
   * @param message description of the failure
   * @param cause the underlying cause
   */
  public RabbitRestConstructionException(String message, Throwable cause) {
    super(message, cause);
  }
}
