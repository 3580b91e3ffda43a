package io.github.wphillipmoore.rabbitmq.rest.admin;

import io.github.wphillipmoore.rabbitmq.rest.admin.auth.Credentials;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestConstructionException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable connection settings for one {@link RabbitRestClient}.
 *
 * <p>The endpoint is the management listener's base URL, without the {@code /api} suffix, e.g.
 * {@code http://localhost:15672}. A path prefix configured on the management plugin is part of the
 * endpoint ({@code http://localhost:15672/rabbitmq}). Trailing slashes are stripped.
 *
 * @param endpoint the management listener's base URI
 * @param credentials the authentication credentials
 * @param timeout the per-request timeout, or {@code null} for no timeout
 * @param verifyTls whether to verify the broker's TLS certificate
 */
public record ClientConfig(
    URI endpoint, Credentials credentials, @Nullable Duration timeout, boolean verifyTls) {

  /** Validates the endpoint and timeout. */
  public ClientConfig {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(credentials, "credentials");
    endpoint = validateEndpoint(endpoint);
    if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
      throw new RabbitRestConstructionException("Timeout must be positive: " + timeout);
    }
  }

  /**
   * Parses an endpoint string.
   *
   * @param endpoint the endpoint URL
   * @return the parsed URI, trailing slashes stripped
   * @throws RabbitRestConstructionException if the string is not a valid http or https URL
   */
  public static URI parseEndpoint(String endpoint) {
    Objects.requireNonNull(endpoint, "endpoint");
    try {
      return validateEndpoint(new URI(endpoint.strip()));
    } catch (URISyntaxException e) {
      throw new RabbitRestConstructionException("Malformed endpoint URL: " + endpoint, e);
    }
  }

  private static URI validateEndpoint(URI endpoint) {
    String scheme = endpoint.getScheme();
    if (scheme == null) {
      throw new RabbitRestConstructionException("Endpoint URL has no scheme: " + endpoint);
    }
    String normalizedScheme = scheme.toLowerCase(Locale.ROOT);
    if (!"http".equals(normalizedScheme) && !"https".equals(normalizedScheme)) {
      throw new RabbitRestConstructionException(
          "Endpoint URL scheme must be http or https: " + endpoint);
    }
    if (endpoint.getHost() == null) {
      if (endpoint.getRawAuthority() != null) {
        throw new RabbitRestConstructionException(
            "Endpoint URL host is not a valid host name (underscores are not allowed): "
                + endpoint.getRawAuthority());
      }
      throw new RabbitRestConstructionException("Endpoint URL has no host: " + endpoint);
    }
    if (endpoint.getRawQuery() != null || endpoint.getRawFragment() != null) {
      throw new RabbitRestConstructionException(
          "Endpoint URL must not carry a query or fragment: " + endpoint);
    }
    return URI.create(stripTrailingSlashes(endpoint.toString()));
  }

  /** Returns the API root all resource paths are relative to, e.g. {@code http://h:15672/api/}. */
  public String apiRoot() {
    return endpoint + "/api/";
  }

  private static String stripTrailingSlashes(String url) {
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    return url;
  }
}
