package io.github.wphillipmoore.rabbitmq.rest.admin;

/** HTTP methods used by the management API operations. */
public enum HttpMethod {
  GET,
  PUT,
  DELETE
}
