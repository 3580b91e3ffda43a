package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Point-in-time snapshot of one queue as reported by {@code GET /api/queues}.
 *
 * <p>The same shape is returned by the list and the single-queue endpoints. The single-queue
 * endpoint additionally reports {@code consumer_details}; on list calls it is empty. Every field
 * is optional on the wire: absent numbers read as zero, absent substructures as {@code null},
 * absent {@code arguments} and {@code consumer_details} as empty collections.
 *
 * <p>{@code (name, vhost)} identifies the queue within a cluster. Instances are immutable and are
 * never sent back to the broker; use {@link #toSettings()} to derive a declaration body.
 *
 * @param name the queue name
 * @param vhost the owning virtual host
 * @param durable whether the queue survives a broker restart
 * @param autoDelete whether the queue is deleted once its last consumer unsubscribes
 * @param exclusive whether the queue is owned by a single connection
 * @param arguments the queue arguments, never null, unmodifiable
 * @param node the cluster node hosting the queue leader
 * @param status the queue's lifecycle status, e.g. {@code "running"}
 * @param state the queue's state tag
 * @param memory bytes of memory used by the queue process
 * @param policy the name of the policy applied to the queue
 * @param consumers the number of consumers
 * @param consumerUtilisation fraction of time the queue can deliver immediately, or {@code null}
 * @param exclusiveConsumerTag the exclusive consumer's tag, or {@code null}
 * @param messages total messages, ready plus unacknowledged
 * @param messagesDetails rate details for {@code messages}, or {@code null}
 * @param messagesReady messages ready for delivery
 * @param messagesReadyDetails rate details for {@code messages_ready}, or {@code null}
 * @param messagesUnacknowledged messages delivered but not yet acknowledged
 * @param messagesUnacknowledgedDetails rate details for {@code messages_unacknowledged}, or
 *     {@code null}
 * @param messagesPersistent persistent messages
 * @param messagesRam messages held in RAM
 * @param messageBytes total size of message bodies
 * @param messageBytesPersistent size of persistent message bodies
 * @param messageBytesRam size of message bodies held in RAM
 * @param messageStats aggregate throughput counters, or {@code null}
 * @param ownerPidDetails the owning connection of an exclusive queue, or {@code null}
 * @param backingQueueStatus storage-engine counters, or {@code null}
 * @param consumerDetails attached consumers, never null, unmodifiable
 */
public record QueueInfo(
    @SerializedName("name") @Nullable String name,
    @SerializedName("vhost") @Nullable String vhost,
    @SerializedName("durable") boolean durable,
    @SerializedName("auto_delete") boolean autoDelete,
    @SerializedName("exclusive") boolean exclusive,
    @SerializedName("arguments") Map<String, JsonElement> arguments,
    @SerializedName("node") @Nullable String node,
    @SerializedName("status") @Nullable String status,
    @SerializedName("state") @Nullable String state,
    @SerializedName("memory") long memory,
    @SerializedName("policy") @Nullable String policy,
    @SerializedName("consumers") int consumers,
    @SerializedName("consumer_utilisation") @Nullable JsonElement consumerUtilisation,
    @SerializedName("exclusive_consumer_tag") @Nullable JsonElement exclusiveConsumerTag,
    @SerializedName("messages") long messages,
    @SerializedName("messages_details") @Nullable RateDetails messagesDetails,
    @SerializedName("messages_ready") long messagesReady,
    @SerializedName("messages_ready_details") @Nullable RateDetails messagesReadyDetails,
    @SerializedName("messages_unacknowledged") long messagesUnacknowledged,
    @SerializedName("messages_unacknowledged_details") @Nullable
        RateDetails messagesUnacknowledgedDetails,
    @SerializedName("messages_persistent") long messagesPersistent,
    @SerializedName("messages_ram") long messagesRam,
    @SerializedName("message_bytes") long messageBytes,
    @SerializedName("message_bytes_persistent") long messageBytesPersistent,
    @SerializedName("message_bytes_ram") long messageBytesRam,
    @SerializedName("message_stats") @Nullable MessageStats messageStats,
    @SerializedName("owner_pid_details") @Nullable OwnerPidDetails ownerPidDetails,
    @SerializedName("backing_queue_status") @Nullable BackingQueueStatus backingQueueStatus,
    @SerializedName("consumer_details") List<ConsumerDetails> consumerDetails) {

  /**
   * Normalizes absent collections to empty, unmodifiable ones.
   *
   * @throws NullPointerException if {@code consumerDetails} contains a {@code null} element
   */
  public QueueInfo {
    arguments =
        arguments == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    consumerDetails = consumerDetails == null ? List.of() : List.copyOf(consumerDetails);
  }

  /**
   * Derives the declaration settings this queue was created with.
   *
   * @return the durable, auto-delete and arguments subset of this snapshot
   */
  public QueueSettings toSettings() {
    return new QueueSettings(durable, autoDelete, arguments);
  }

  /** Returns whether the queue currently has at least one consumer. */
  public boolean hasConsumers() {
    return consumers > 0;
  }
}
