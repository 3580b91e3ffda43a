package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

/**
 * Base exception for all RabbitMQ management API errors.
 *
 * <p>This is an unchecked exception hierarchy. Callers that need to tell failures apart catch the
 * concrete subclass: a request that can never succeed, a request that never got a response, a
 * response with a non-success status, or a success response that could not be decoded.
 */
public sealed class RabbitRestException extends RuntimeException
    permits RabbitRestConstructionException,
        RabbitRestTransportException,
        RabbitRestHttpException,
        RabbitRestDecodeException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  public RabbitRestException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  public RabbitRestException(String message, Throwable cause) {
    super(message, cause);
  }
}
