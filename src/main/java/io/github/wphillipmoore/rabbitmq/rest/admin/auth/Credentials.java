package io.github.wphillipmoore.rabbitmq.rest.admin.auth;

/**
 * Sealed credential type for RabbitMQ management API authentication.
 *
 * <p>The request builder dispatches on the concrete type using {@code instanceof} pattern matching
 * to choose the {@code Authorization} scheme.
 */
public sealed interface Credentials permits BasicAuth, BearerAuth {}
