package io.github.wphillipmoore.rabbitmq.rest.admin;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;
import com.google.gson.Strictness;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestDecodeException;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestHttpException;
import java.io.IOException;
import java.util.Collection;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Classifies management API responses and decodes success bodies into typed results.
 *
 * <p>A non-2xx status always becomes a {@link RabbitRestHttpException}, whether or not a payload
 * was expected. A 2xx response whose body cannot be decoded into the requested type becomes a
 * {@link RabbitRestDecodeException}, so callers can tell a rejected request from malformed data.
 * Decoding is all-or-nothing: bodies must be strict RFC 8259 JSON, and an array element that is
 * {@code null} or missing fails the whole response instead of being dropped.
 */
public final class ResponseDecoder {

  private static final Gson GSON =
      new GsonBuilder()
          .setStrictness(Strictness.STRICT)
          .registerTypeAdapterFactory(new NullElementRejectingFactory())
          .create();

  private ResponseDecoder() {}

  /**
   * Checks the status and decodes the body into {@code type}.
   *
   * @param <T> the target type
   * @param request the request the response answers
   * @param response the transport response
   * @param type the target type, e.g. {@code new TypeToken<List<QueueInfo>>() {}}
   * @return the decoded value, never null
   * @throws RabbitRestHttpException if the status is outside the 2xx range
   * @throws RabbitRestDecodeException if the body is empty, {@code null} or does not match {@code
   *     type}
   */
  public static <T> T decode(RestRequest request, TransportResponse response, TypeToken<T> type) {
    Objects.requireNonNull(type, "type");
    checkStatus(request, response);

    String body = response.body();
    T result;
    try {
      result = GSON.fromJson(body, type);
    } catch (JsonParseException e) {
      throw new RabbitRestDecodeException(
          "Response body does not match " + type, request.url(), body, e);
    }
    if (result == null) {
      throw new RabbitRestDecodeException("Response body is empty", request.url(), body);
    }
    return result;
  }

  /**
   * Checks the status of a response that carries no payload of interest.
   *
   * @param request the request the response answers
   * @param response the transport response
   * @throws RabbitRestHttpException if the status is outside the 2xx range
   */
  public static void checkStatus(RestRequest request, TransportResponse response) {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(response, "response");
    if (!response.isSuccess()) {
      throw toHttpException(request, response);
    }
  }

  static RabbitRestHttpException toHttpException(RestRequest request, TransportResponse response) {
    int statusCode = response.statusCode();
    ErrorDocument document = parseErrorDocument(response.body());

    StringBuilder message = new StringBuilder(96);
    message
        .append(request.method())
        .append(' ')
        .append(request.url())
        .append(" failed: HTTP ")
        .append(statusCode)
        .append(' ')
        .append(RabbitRestHttpException.reasonPhraseFor(statusCode));
    if (document.error() != null) {
      message.append(" (").append(document.error());
      if (document.reason() != null) {
        message.append(": ").append(document.reason());
      }
      message.append(')');
    }

    return new RabbitRestHttpException(
        message.toString(),
        request.method().name(),
        request.url(),
        statusCode,
        response.body(),
        document.error(),
        document.reason());
  }

  /**
   * Extracts {@code error} and {@code reason} from a broker error body.
   *
   * <p>Bodies that are not a JSON object, such as HTML from a proxy, yield an empty document; the
   * raw text is still carried by the exception.
   */
  static ErrorDocument parseErrorDocument(String body) {
    if (body.isBlank()) {
      return ErrorDocument.EMPTY;
    }
    JsonElement parsed;
    try {
      parsed = JsonParser.parseString(body);
    } catch (JsonParseException e) {
      return ErrorDocument.EMPTY;
    }
    if (!parsed.isJsonObject()) {
      return ErrorDocument.EMPTY;
    }
    JsonObject object = parsed.getAsJsonObject();
    return new ErrorDocument(stringMember(object, "error"), stringMember(object, "reason"));
  }

  private static @Nullable String stringMember(JsonObject object, String name) {
    JsonElement member = object.get(name);
    if (member == null || !member.isJsonPrimitive()) {
      return null;
    }
    return member.getAsString();
  }

  record ErrorDocument(@Nullable String error, @Nullable String reason) {
    static final ErrorDocument EMPTY = new ErrorDocument(null, null);
  }

  /** Fails collection reads that contain a {@code null} element. */
  static final class NullElementRejectingFactory implements TypeAdapterFactory {

    @Override
    public <T> @Nullable TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
      if (!Collection.class.isAssignableFrom(type.getRawType())) {
        return null;
      }
      TypeAdapter<T> delegate = gson.getDelegateAdapter(this, type);
      return new TypeAdapter<T>() {
        @Override
        public void write(JsonWriter out, T value) throws IOException {
          delegate.write(out, value);
        }

        @Override
        public T read(JsonReader in) throws IOException {
          String path = in.getPath();
          T value = delegate.read(in);
          if (value instanceof Collection<?> elements && elements.contains(null)) {
            throw new JsonSyntaxException("Null array element at " + path);
          }
          return value;
        }
      };
    }
  }
}
