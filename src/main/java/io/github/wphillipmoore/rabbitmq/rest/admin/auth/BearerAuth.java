package io.github.wphillipmoore.rabbitmq.rest.admin.auth;

import java.util.Objects;

/**
 * Token credentials for a management plugin configured with OAuth 2.0.
 *
 * <p>Used to construct an {@code Authorization: Bearer} header on every request.
 *
 * @param token the access token, never null or blank
 */
public record BearerAuth(String token) implements Credentials {

  /** Validates that the token is present. */
  public BearerAuth {
    Objects.requireNonNull(token, "token");
    if (token.isBlank()) {
      throw new IllegalArgumentException("token must not be blank");
    }
  }

  /** Masks the token. */
  @Override
  public String toString() {
    return "BearerAuth[token=****]";
  }
}
