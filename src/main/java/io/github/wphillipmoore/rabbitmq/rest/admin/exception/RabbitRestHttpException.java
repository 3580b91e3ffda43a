package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when the management API answers with a status outside the 2xx range.
 *
 * <p>The raw response body is always preserved. When the broker returned its usual error document
 * ({@code {"error": "not_found", "reason": "Object Not Found"}}) the two fields are exposed through
 * {@link #getError()} and {@link #getReason()}; otherwise both are {@code null}.
 */
public final class RabbitRestHttpException extends RabbitRestException {

  private static final long serialVersionUID = 1L;

  private static final Map<Integer, String> REASON_PHRASES =
      Map.ofEntries(
          Map.entry(300, "Multiple Choices"),
          Map.entry(301, "Moved Permanently"),
          Map.entry(302, "Found"),
          Map.entry(304, "Not Modified"),
          Map.entry(400, "Bad Request"),
          Map.entry(401, "Unauthorized"),
          Map.entry(403, "Forbidden"),
          Map.entry(404, "Not Found"),
          Map.entry(405, "Method Not Allowed"),
          Map.entry(406, "Not Acceptable"),
          Map.entry(408, "Request Timeout"),
          Map.entry(409, "Conflict"),
          Map.entry(412, "Precondition Failed"),
          Map.entry(413, "Content Too Large"),
          Map.entry(415, "Unsupported Media Type"),
          Map.entry(429, "Too Many Requests"),
          Map.entry(500, "Internal Server Error"),
          Map.entry(501, "Not Implemented"),
          Map.entry(502, "Bad Gateway"),
          Map.entry(503, "Service Unavailable"),
          Map.entry(504, "Gateway Timeout"));

  private final String method;
  private final String url;
  private final int statusCode;
  private final String reasonPhrase;
  private final String responseText;
  private final @Nullable String error;
  private final @Nullable String reason;

  /**
   * Creates an HTTP exception.
   *
   * @param message description of the failure
   * @param method the HTTP method of the failed request
   * @param url the URL of the failed request
   * @param statusCode the HTTP status code
   * @param responseText the raw response text, never null (empty if no body)
   * @param error the broker's {@code error} field, or {@code null} if absent
   * @param reason the broker's {@code reason} field, or {@code null} if absent
   */
  public RabbitRestHttpException(
      String message,
      String method,
      String url,
      int statusCode,
      String responseText,
      @Nullable String error,
      @Nullable String reason) {
    super(message);
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
    this.statusCode = statusCode;
    this.reasonPhrase = reasonPhraseFor(statusCode);
    this.responseText = Objects.requireNonNull(responseText, "responseText");
    this.error = error;
    this.reason = reason;
  }

  /**
   * Returns the standard reason phrase for a status code.
   *
   * @param statusCode the HTTP status code
   * @return the reason phrase, or {@code "Unknown Status"} for codes outside the table
   */
  public static String reasonPhraseFor(int statusCode) {
    return REASON_PHRASES.getOrDefault(statusCode, "Unknown Status");
  }

  /** Returns the HTTP method of the failed request. */
  public String getMethod() {
    return method;
  }

  /** Returns the URL of the failed request. */
  public String getUrl() {
    return url;
  }

  /** Returns the HTTP status code. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Returns the reason phrase matching the status code. */
  public String getReasonPhrase() {
    return reasonPhrase;
  }

  /** Returns the raw response text. */
  public String getResponseText() {
    return responseText;
  }

  /** Returns the broker's {@code error} field, or {@code null} if the body did not carry one. */
  public @Nullable String getError() {
    return error;
  }

  /** Returns the broker's {@code reason} field, or {@code null} if the body did not carry one. */
  public @Nullable String getReason() {
    return reason;
  }

  /** Returns whether the queue or vhost addressed by the request does not exist. */
  public boolean isNotFound() {
    return statusCode == 404;
  }

  /** Returns whether the request conflicted with the current state of the resource. */
  public boolean isConflict() {
    return statusCode == 409;
  }

  /** Returns whether the status is in the 4xx range. */
  public boolean isClientError() {
    return statusCode >= 400 && statusCode < 500;
  }

  /** Returns whether the status is in the 5xx range. */
  public boolean isServerError() {
    return statusCode >= 500 && statusCode < 600;
  }
}
