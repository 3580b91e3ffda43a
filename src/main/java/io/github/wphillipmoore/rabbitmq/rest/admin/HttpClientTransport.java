package io.github.wphillipmoore.rabbitmq.rest.admin;

import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestTransportException;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.jspecify.annotations.Nullable;

/**
 * {@link RabbitRestTransport} on top of the JDK {@link HttpClient}.
 *
 * <p>Connection pooling, redirects and TLS are left to the JDK client, which is shared by all
 * calls. When a call asks for TLS verification to be skipped, a second client that trusts every
 * certificate is built on first use and kept for later calls.
 */
public final class HttpClientTransport implements RabbitRestTransport {

  private final HttpClient verifyingClient;
  private @Nullable HttpClient insecureClient;

  /** Creates a transport that verifies TLS certificates against the JVM trust store. */
  public HttpClientTransport() {
    this(newClient(null));
  }

  /**
   * Creates a transport with a custom {@link SSLContext}, e.g. for a private CA or mutual TLS.
   *
   * @param sslContext the SSL context used when TLS verification is requested
   */
  public HttpClientTransport(SSLContext sslContext) {
    this(newClient(Objects.requireNonNull(sslContext, "sslContext")));
  }

  HttpClientTransport(HttpClient verifyingClient) {
    this.verifyingClient = Objects.requireNonNull(verifyingClient, "verifyingClient");
  }

  @Override
  @SuppressWarnings("PMD.CloseResource") // clients live as long as the transport
  public TransportResponse execute(
      RestRequest request, @Nullable Duration timeout, boolean verifyTls) {
    Objects.requireNonNull(request, "request");
    HttpClient client = verifyTls ? verifyingClient : insecureClient();
    String target = request.method() + " " + request.url();

    HttpResponse<String> response;
    try {
      response =
          client.send(
              toHttpRequest(request, timeout),
              HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (HttpTimeoutException e) {
      throw new RabbitRestTransportException(
          target + " timed out after " + timeout, request.url(), e);
    } catch (SSLException e) {
      throw new RabbitRestTransportException(
          target + " failed TLS negotiation: " + e.getMessage(), request.url(), e);
    } catch (IOException e) {
      throw new RabbitRestTransportException(
          target + " failed: " + describe(e), request.url(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RabbitRestTransportException(target + " was interrupted", request.url(), e);
    }

    String body = response.body();
    return new TransportResponse(
        response.statusCode(), body == null ? "" : body, singleValued(response.headers()));
  }

  /** Maps a request onto the JDK request type. A {@code null} timeout means none. */
  static HttpRequest toHttpRequest(RestRequest request, @Nullable Duration timeout) {
    String body = request.body();
    HttpRequest.Builder builder =
        HttpRequest.newBuilder(request.uri())
            .method(
                request.method().name(),
                body == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
    request.headers().forEach(builder::header);
    if (timeout != null) {
      builder.timeout(timeout);
    }
    return builder.build();
  }

  private synchronized HttpClient insecureClient() {
    if (insecureClient == null) {
      insecureClient = newClient(trustAllContext("TLS"));
    }
    return insecureClient;
  }

  private static HttpClient newClient(@Nullable SSLContext sslContext) {
    HttpClient.Builder builder =
        HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL);
    if (sslContext != null) {
      builder.sslContext(sslContext);
    }
    return builder.build();
  }

  private static String describe(IOException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  /**
   * Builds an {@link SSLContext} that accepts any server certificate.
   *
   * @param protocol the protocol name, e.g. {@code "TLS"}
   * @return the initialized context
   * @throws IllegalStateException if the protocol is not supported by the JVM
   */
  static SSLContext trustAllContext(String protocol) {
    try {
      SSLContext context = SSLContext.getInstance(protocol);
      context.init(null, new TrustManager[] {new TrustAllManager()}, null);
      return context;
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Cannot create " + protocol + " context", e);
    }
  }

  /**
   * Collapses repeated response headers into one value per name, joined with {@code ", "} as RFC
   * 9110 allows.
   */
  static Map<String, String> singleValued(HttpHeaders headers) {
    Map<String, String> result = new LinkedHashMap<>();
    headers.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }

  static final class TrustAllManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // not consulted for client-side connections
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // verification disabled by the caller
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
