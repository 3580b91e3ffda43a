package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.annotations.JsonAdapter;
import com.google.gson.annotations.SerializedName;
import org.jspecify.annotations.Nullable;

/**
 * The channel a consumer was registered on.
 *
 * @param name the channel name, e.g. {@code "127.0.0.1:52814 -> 127.0.0.1:5672 (1)"}
 * @param number the channel number within its connection
 * @param user the user that opened the connection
 * @param connectionName the owning connection's name
 * @param peerHost the client host
 * @param peerPort the client port, or {@code null} if the broker reported none
 */
public record ChannelDetails(
    @SerializedName("name") @Nullable String name,
    @SerializedName("number") int number,
    @SerializedName("user") @Nullable String user,
    @SerializedName("connection_name") @Nullable String connectionName,
    @SerializedName("peer_host") @Nullable String peerHost,
    @SerializedName("peer_port") @JsonAdapter(PortTypeAdapter.class) @Nullable Integer peerPort) {}
