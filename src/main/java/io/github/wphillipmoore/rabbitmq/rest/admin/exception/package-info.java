/** Unchecked exception hierarchy for RabbitMQ management API failures. */
@NullMarked
package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

import org.jspecify.annotations.NullMarked;
