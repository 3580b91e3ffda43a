package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import org.jspecify.annotations.Nullable;

/**
 * Reads a {@code peer_port} value that the broker may report as a number, a numeric string, or a
 * placeholder such as {@code "unknown"} for direct and internal connections.
 *
 * <p>Placeholders, out-of-range values and strings with anything but ASCII digits read as {@code
 * null}.
 */
final class PortTypeAdapter extends TypeAdapter<@Nullable Integer> {

  static final int MAX_PORT = 65_535;

  @Override
  public void write(JsonWriter out, @Nullable Integer value) throws IOException {
    if (value == null) {
      out.nullValue();
    } else {
      out.value(value);
    }
  }

  @Override
  public @Nullable Integer read(JsonReader in) throws IOException {
    JsonToken token = in.peek();
    switch (token) {
      case NULL:
        in.nextNull();
        return null;
      case NUMBER:
        return toPort(in.nextDouble());
      case STRING:
        return parsePort(in.nextString().trim());
      default:
        in.skipValue();
        return null;
    }
  }

  static @Nullable Integer parsePort(String text) {
    if (text.isEmpty() || text.length() > 5) {
      return null;
    }
    for (int charIndex = 0; charIndex < text.length(); charIndex++) {
      char digit = text.charAt(charIndex);
      if (digit < '0' || digit > '9') {
        return null;
      }
    }
    return toPort(Integer.parseInt(text));
  }

  private static @Nullable Integer toPort(double value) {
    if (value < 0 || value > MAX_PORT || value != Math.rint(value)) {
      return null;
    }
    return (int) value;
  }
}
