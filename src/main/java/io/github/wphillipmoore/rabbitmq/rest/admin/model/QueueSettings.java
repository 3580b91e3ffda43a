package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;
import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Request body for declaring (creating or updating) a queue.
 *
 * <p>Only the three settings the management API accepts on {@code PUT /api/queues/{vhost}/{name}}
 * are carried; a {@link QueueInfo} snapshot is never sent back. The broker requires the {@code
 * arguments} field to be present, so a {@code null} map is normalized to an empty one and the body
 * always serializes as {@code "arguments":{}} at minimum.
 *
 * <pre>{@code
 * QueueSettings settings = QueueSettings.builder()
 *     .durable(true)
 *     .argument("x-queue-type", "quorum")
 *     .argument("x-max-length", 10_000)
 *     .build();
 * }</pre>
 *
 * @param durable whether the queue survives a broker restart
 * @param autoDelete whether the queue is deleted once its last consumer unsubscribes
 * @param arguments optional queue arguments, never null, unmodifiable
 */
public record QueueSettings(
    @SerializedName("durable") boolean durable,
    @SerializedName("auto_delete") boolean autoDelete,
    @SerializedName("arguments") Map<String, JsonElement> arguments) {

  /** Normalizes absent arguments to an empty map and null values to JSON null. */
  public QueueSettings {
    Map<String, JsonElement> copy = new LinkedHashMap<>();
    if (arguments != null) {
      arguments.forEach(
          (key, value) ->
              copy.put(Objects.requireNonNull(key, "argument key"), nullToJsonNull(value)));
    }
    arguments = Collections.unmodifiableMap(copy);
  }

  /**
   * Creates settings without arguments.
   *
   * @param durable whether the queue survives a broker restart
   * @param autoDelete whether the queue is deleted once its last consumer unsubscribes
   */
  public QueueSettings(boolean durable, boolean autoDelete) {
    this(durable, autoDelete, Map.of());
  }

  /** Returns a builder with {@code durable} and {@code autoDelete} both {@code false}. */
  public static Builder builder() {
    return new Builder();
  }

  private static JsonElement nullToJsonNull(@Nullable JsonElement value) {
    return value == null ? JsonNull.INSTANCE : value;
  }

  /** Fluent builder for {@link QueueSettings}. */
  public static final class Builder {

    private boolean durable;
    private boolean autoDelete;
    private final Map<String, JsonElement> arguments = new LinkedHashMap<>();

    private Builder() {}

    /** Sets whether the queue survives a broker restart. */
    public Builder durable(boolean durable) {
      this.durable = durable;
      return this;
    }

    /** Sets whether the queue is deleted once its last consumer unsubscribes. */
    public Builder autoDelete(boolean autoDelete) {
      this.autoDelete = autoDelete;
      return this;
    }

    /** Adds a string-valued argument such as {@code x-queue-type}. */
    public Builder argument(String key, String value) {
      return argument(key, new JsonPrimitive(Objects.requireNonNull(value, "value")));
    }

    /** Adds a numeric argument such as {@code x-max-length} or {@code x-message-ttl}. */
    public Builder argument(String key, Number value) {
      return argument(key, new JsonPrimitive(Objects.requireNonNull(value, "value")));
    }

    /** Adds a boolean argument such as {@code x-single-active-consumer}. */
    public Builder argument(String key, boolean value) {
      return argument(key, new JsonPrimitive(value));
    }

    /** Adds an argument of arbitrary JSON shape. */
    public Builder argument(String key, JsonElement value) {
      arguments.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
      return this;
    }

    /** Builds the settings. */
    public QueueSettings build() {
      return new QueueSettings(durable, autoDelete, arguments);
    }
  }
}
