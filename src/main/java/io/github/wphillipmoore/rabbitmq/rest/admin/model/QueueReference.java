package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.annotations.SerializedName;
import org.jspecify.annotations.Nullable;

/**
 * Name and vhost of the queue a consumer is attached to.
 *
 * @param name the queue name
 * @param vhost the virtual host
 */
public record QueueReference(
    @SerializedName("name") @Nullable String name,
    @SerializedName("vhost") @Nullable String vhost) {}
