package io.github.wphillipmoore.rabbitmq.rest.admin.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conditions under which a queue delete is allowed to proceed.
 *
 * <p>When a condition is not met the broker refuses the delete with a 400 response.
 *
 * @param ifEmpty only delete when the queue holds no messages
 * @param ifUnused only delete when the queue has no consumers
 */
public record QueueDeleteOptions(boolean ifEmpty, boolean ifUnused) {

  /** Unconditional delete. */
  public static final QueueDeleteOptions NONE = new QueueDeleteOptions(false, false);

  /** Returns the query parameters for this set of conditions. */
  public Map<String, String> toQueryParameters() {
    Map<String, String> query = new LinkedHashMap<>();
    if (ifEmpty) {
      query.put("if-empty", "true");
    }
    if (ifUnused) {
      query.put("if-unused", "true");
    }
    return query;
  }
}
