package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.annotations.SerializedName;
import org.jspecify.annotations.Nullable;

/**
 * A consumer attached to a queue, cross-referencing its channel and the queue itself.
 *
 * @param channelDetails the consumer's channel, or {@code null} if not reported
 * @param queue the queue consumed from, or {@code null} if not reported
 * @param consumerTag the consumer tag
 * @param exclusive whether the consumer is exclusive
 * @param ackRequired whether deliveries require manual acknowledgement
 * @param prefetchCount the per-consumer prefetch limit, zero for unlimited
 */
public record ConsumerDetails(
    @SerializedName("channel_details") @Nullable ChannelDetails channelDetails,
    @SerializedName("queue") @Nullable QueueReference queue,
    @SerializedName("consumer_tag") @Nullable String consumerTag,
    @SerializedName("exclusive") boolean exclusive,
    @SerializedName("ack_required") boolean ackRequired,
    @SerializedName("prefetch_count") int prefetchCount) {}
