package io.github.wphillipmoore.rabbitmq.rest.admin;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import io.github.wphillipmoore.rabbitmq.rest.admin.auth.BasicAuth;
import io.github.wphillipmoore.rabbitmq.rest.admin.auth.BearerAuth;
import io.github.wphillipmoore.rabbitmq.rest.admin.auth.Credentials;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestConstructionException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Composes authenticated {@link RestRequest}s against a configured endpoint.
 *
 * <p>Stateless apart from the immutable {@link ClientConfig}; safe for concurrent use.
 */
public final class RequestBuilder {

  static final String JSON_CONTENT_TYPE = "application/json";

  private static final Escaper QUERY_ESCAPER = UrlEscapers.urlFormParameterEscaper();

  private final ClientConfig config;

  /**
   * Creates a builder for the given configuration.
   *
   * @param config the client configuration
   */
  public RequestBuilder(ClientConfig config) {
    this.config = Objects.requireNonNull(config, "config");
  }

  /**
   * Builds a request without a body or query parameters.
   *
   * @param method the HTTP method
   * @param path the resource path relative to {@code /api/}
   * @return the request
   */
  public RestRequest build(HttpMethod method, ResourcePath path) {
    return build(method, path, Map.of(), null);
  }

  /**
   * Builds a request.
   *
   * @param method the HTTP method
   * @param path the resource path relative to {@code /api/}
   * @param query query parameters, escaped and appended in iteration order
   * @param body the serialized JSON body, or {@code null}
   * @return the request
   * @throws RabbitRestConstructionException if the composed URL is invalid
   */
  public RestRequest build(
      HttpMethod method, ResourcePath path, Map<String, String> query, @Nullable String body) {
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(query, "query");

    String url = config.apiRoot() + path.encoded() + buildQueryString(query);
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException e) {
      throw new RabbitRestConstructionException("Invalid request URL: " + url, e);
    }

    return new RestRequest(method, uri, buildHeaders(body != null), body);
  }

  private Map<String, String> buildHeaders(boolean hasBody) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Accept", JSON_CONTENT_TYPE);
    headers.put("Authorization", buildAuthorizationHeader(config.credentials()));
    if (hasBody) {
      headers.put("Content-Type", JSON_CONTENT_TYPE);
    }
    return headers;
  }

  static String buildAuthorizationHeader(Credentials credentials) {
    if (credentials instanceof BasicAuth basicAuth) {
      return buildBasicAuthHeader(basicAuth.username(), basicAuth.password());
    }
    BearerAuth bearerAuth = (BearerAuth) credentials;
    return "Bearer " + bearerAuth.token();
  }

  static String buildBasicAuthHeader(String username, String password) {
    String credentials = username + ":" + password;
    String encoded =
        Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    return "Basic " + encoded;
  }

  static String buildQueryString(Map<String, String> query) {
    if (query.isEmpty()) {
      return "";
    }
    StringBuilder queryString = new StringBuilder(32);
    for (Map.Entry<String, String> entry : query.entrySet()) {
      queryString
          .append(queryString.length() == 0 ? '?' : '&')
          .append(QUERY_ESCAPER.escape(entry.getKey()))
          .append('=')
          .append(QUERY_ESCAPER.escape(entry.getValue()));
    }
    return queryString.toString();
  }
}
