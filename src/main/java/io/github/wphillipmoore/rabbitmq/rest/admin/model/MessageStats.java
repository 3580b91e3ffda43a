package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.annotations.SerializedName;
import org.jspecify.annotations.Nullable;

/**
 * Aggregate message throughput counters for a queue.
 *
 * <p>Counters the broker has not yet seen activity for are absent and read as zero; their rate
 * details are {@code null}.
 */
public record MessageStats(
    @SerializedName("publish") long publish,
    @SerializedName("publish_details") @Nullable RateDetails publishDetails,
    @SerializedName("deliver") long deliver,
    @SerializedName("deliver_details") @Nullable RateDetails deliverDetails,
    @SerializedName("deliver_no_ack") long deliverNoAck,
    @SerializedName("deliver_no_ack_details") @Nullable RateDetails deliverNoAckDetails,
    @SerializedName("deliver_get") long deliverGet,
    @SerializedName("deliver_get_details") @Nullable RateDetails deliverGetDetails,
    @SerializedName("redeliver") long redeliver,
    @SerializedName("redeliver_details") @Nullable RateDetails redeliverDetails,
    @SerializedName("get") long get,
    @SerializedName("get_details") @Nullable RateDetails getDetails,
    @SerializedName("get_no_ack") long getNoAck,
    @SerializedName("get_no_ack_details") @Nullable RateDetails getNoAckDetails,
    @SerializedName("ack") long ack,
    @SerializedName("ack_details") @Nullable RateDetails ackDetails) {}
