package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;
import org.jspecify.annotations.Nullable;

/**
 * The connection that exclusively owns a queue.
 *
 * @param name the connection name
 * @param peerHost the client host
 * @param peerPort the client port, or {@code null} if the broker reported none
 */
public record OwnerPidDetails(
    @SerializedName("name") @Nullable String name,
    @SerializedName("peer_host") @Nullable String peerHost,
    @SerializedName("peer_port") @JsonAdapter(PortTypeAdapter.class) @Nullable Integer peerPort) {}
