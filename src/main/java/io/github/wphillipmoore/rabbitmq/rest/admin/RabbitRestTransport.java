package io.github.wphillipmoore.rabbitmq.rest.admin;

import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for RabbitMQ management API HTTP communication.
 *
 * <p>Implementations perform exactly one synchronous exchange per call, never retry, and return
 * the response whatever its status code. They throw {@link
 * io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestTransportException} when no
 * response could be received.
 */
public interface RabbitRestTransport {

  /**
   * Sends a request to the management API.
   *
   * @param request the fully-formed request
   * @param timeout request timeout, or {@code null} for no timeout
   * @param verifyTls whether to verify TLS certificates
   * @return the transport response
   */
  TransportResponse execute(RestRequest request, @Nullable Duration timeout, boolean verifyTls);
}
