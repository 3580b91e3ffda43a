/**
 * Typed client for the RabbitMQ management HTTP API.
 *
 * <p>{@link io.github.wphillipmoore.rabbitmq.rest.admin.RabbitRestClient} is the entry point.
 * Requests are composed by {@link io.github.wphillipmoore.rabbitmq.rest.admin.RequestBuilder},
 * sent by a {@link io.github.wphillipmoore.rabbitmq.rest.admin.RabbitRestTransport} and decoded by
 * {@link io.github.wphillipmoore.rabbitmq.rest.admin.ResponseDecoder}.
 */
@NullMarked
package io.github.wphillipmoore.rabbitmq.rest.admin;

import org.jspecify.annotations.NullMarked;
