package io.github.wphillipmoore.rabbitmq.rest.admin;

import java.net.URI;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A fully-formed, authenticated management API request, ready for a {@link RabbitRestTransport}.
 *
 * @param method the HTTP method
 * @param uri the absolute request URI
 * @param headers the request headers, never null, unmodifiable
 * @param body the serialized JSON body, or {@code null} for requests without one
 */
public record RestRequest(
    HttpMethod method, URI uri, Map<String, String> headers, @Nullable String body) {

  /** Validates non-null fields and defensively copies headers. */
  public RestRequest {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(uri, "uri");
    headers = Map.copyOf(Objects.requireNonNull(headers, "headers"));
  }

  /** Returns the request URI as a string. */
  public String url() {
    return uri.toString();
  }

  /** Masks credentials so requests can be logged safely. */
  @Override
  public String toString() {
    return "RestRequest[" + method + " " + uri + (body == null ? "" : ", body=" + body) + "]";
  }
}
