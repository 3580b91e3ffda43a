/** Credential types accepted by the management API client. */
@NullMarked
package io.github.wphillipmoore.rabbitmq.rest.admin.auth;

import org.jspecify.annotations.NullMarked;
