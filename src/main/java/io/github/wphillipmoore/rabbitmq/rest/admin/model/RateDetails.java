package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.annotations.SerializedName;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Moving-average rate reported alongside a counter, for example {@code messages_details}.
 *
 * <p>{@code avg}, {@code avg_rate} and {@code samples} are only reported when the request asked
 * for sampled statistics.
 *
 * @param rate the current per-second rate
 * @param avg the average counter value over the sampled window, or {@code null}
 * @param avgRate the average rate over the sampled window, or {@code null}
 * @param samples the raw samples, never null
 */
public record RateDetails(
    @SerializedName("rate") double rate,
    @SerializedName("avg") @Nullable Double avg,
    @SerializedName("avg_rate") @Nullable Double avgRate,
    @SerializedName("samples") List<RateDetailSample> samples) {

  /** Normalizes an absent sample list to an empty one; {@code null} samples are rejected. */
  public RateDetails {
    samples = samples == null ? List.of() : List.copyOf(samples);
  }
}
