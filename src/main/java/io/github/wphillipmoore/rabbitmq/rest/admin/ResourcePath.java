package io.github.wphillipmoore.rabbitmq.rest.admin;

import com.google.common.escape.Escaper;
import com.google.common.net.UrlEscapers;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestConstructionException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * A management API resource path, relative to {@code /api/}, made of independently escaped
 * segments.
 *
 * <p>Each segment is percent-encoded on its own, so a vhost or queue name containing {@code /}
 * stays a single segment. The default vhost {@code "/"} encodes as {@code %2F}.
 *
 * <pre>{@code
 * ResourcePath.of("queues", "/", "orders").encoded();  // "queues/%2F/orders"
 * }</pre>
 */
public final class ResourcePath {

  private static final Escaper SEGMENT_ESCAPER = UrlEscapers.urlPathSegmentEscaper();

  private final List<String> segments;

  private ResourcePath(List<String> segments) {
    this.segments = segments;
  }

  /**
   * Creates a path from raw, unescaped segments.
   *
   * @param segments the segments, e.g. {@code "queues", vhost, name}
   * @return the path
   * @throws RabbitRestConstructionException if there are no segments or a segment is empty
   * @throws NullPointerException if a segment is null
   */
  public static ResourcePath of(String... segments) {
    Objects.requireNonNull(segments, "segments");
    if (segments.length == 0) {
      throw new RabbitRestConstructionException("Resource path must have at least one segment");
    }
    for (String segment : segments) {
      Objects.requireNonNull(segment, "segment");
      if (segment.isEmpty()) {
        throw new RabbitRestConstructionException("Resource path segment must not be empty");
      }
    }
    return new ResourcePath(List.of(segments));
  }

  /**
   * Returns a new path with one more raw segment appended.
   *
   * @param segment the raw segment, e.g. {@code "contents"}
   * @return the extended path
   */
  public ResourcePath append(String segment) {
    String[] extended = segments.toArray(new String[segments.size() + 1]);
    extended[segments.size()] = segment;
    return of(extended);
  }

  /** Returns the raw, unescaped segments. */
  public List<String> segments() {
    return segments;
  }

  /** Returns the escaped path, segments joined with {@code /}. */
  public String encoded() {
    return segments.stream().map(SEGMENT_ESCAPER::escape).collect(Collectors.joining("/"));
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof ResourcePath path && segments.equals(path.segments);
  }

  @Override
  public int hashCode() {
    return segments.hashCode();
  }

  @Override
  public String toString() {
    return encoded();
  }
}
