/**
 * Typed representations of management API resources.
 *
 * <p>All types are immutable records decoded with Gson. JSON field names are declared with
 * {@code @SerializedName}; dynamically-typed values such as queue arguments are held as {@link
 * com.google.gson.JsonElement}.
 */
@NullMarked
package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import org.jspecify.annotations.NullMarked;
