package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.annotations.SerializedName;
import org.jspecify.annotations.Nullable;

/**
 * Storage-engine counters of a classic queue's backing queue.
 *
 * <p>Diagnostic only. The four {@code q1}..{@code q4} segments follow the broker's generational
 * layout of messages held in RAM versus paged to disk.
 */
public record BackingQueueStatus(
    @SerializedName("q1") int q1,
    @SerializedName("q2") int q2,
    @SerializedName("q3") int q3,
    @SerializedName("q4") int q4,
    @SerializedName("len") long length,
    @SerializedName("pending_acks") long pendingAcks,
    @SerializedName("ram_msg_count") long ramMessageCount,
    @SerializedName("ram_ack_count") long ramAckCount,
    @SerializedName("persistent_count") long persistentCount,
    @SerializedName("avg_ingress_rate") double averageIngressRate,
    @SerializedName("avg_egress_rate") double averageEgressRate,
    @SerializedName("avg_ack_ingress_rate") double averageAckIngressRate,
    @SerializedName("avg_ack_egress_rate") double averageAckEgressRate,
    @SerializedName("mode") @Nullable String mode) {}
