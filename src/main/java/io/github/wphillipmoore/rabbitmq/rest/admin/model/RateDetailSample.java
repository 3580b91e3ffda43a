package io.github.wphillipmoore.rabbitmq.rest.admin.model;

/**
 * One sampled counter value.
 *
 * @param sample the counter value at the sample point
 * @param timestamp the sample time in milliseconds since the epoch
 */
public record RateDetailSample(long sample, long timestamp) {}
