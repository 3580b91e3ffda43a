package io.github.wphillipmoore.rabbitmq.rest.admin;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.reflect.TypeToken;
import io.github.wphillipmoore.rabbitmq.rest.admin.auth.Credentials;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.QueueDeleteOptions;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.QueueInfo;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.QueueSettings;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the queue resources of the RabbitMQ management HTTP API.
 *
 * <p>Every operation is a single synchronous round-trip: the request is composed by a {@link
 * RequestBuilder}, sent by the {@link RabbitRestTransport}, and classified and decoded by the
 * {@link ResponseDecoder}. Nothing is retried or cached. Failures surface as subclasses of {@link
 * io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestException}.
 *
 * <p>Instances are immutable and safe for concurrent use. They are created via the {@link
 * Builder}:
 *
 * <pre>{@code
 * RabbitRestClient client = new RabbitRestClient.Builder(
 *         "http://localhost:15672", new BasicAuth("guest", "guest"))
 *     .timeout(Duration.ofSeconds(10))
 *     .build();
 *
 * client.declareQueue("/", "orders", QueueSettings.builder().durable(true).build());
 * QueueInfo orders = client.getQueue("/", "orders");
 * }</pre>
 */
public final class RabbitRestClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(RabbitRestClient.class);

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  static final String QUEUES = "queues";
  static final String CONTENTS = "contents";

  private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();
  private static final TypeToken<List<QueueInfo>> QUEUE_LIST = new TypeToken<List<QueueInfo>>() {};
  private static final TypeToken<QueueInfo> QUEUE = TypeToken.get(QueueInfo.class);

  private final ClientConfig config;
  private final RequestBuilder requestBuilder;
  private final RabbitRestTransport transport;

  private RabbitRestClient(Builder builder) {
    this.config =
        new ClientConfig(
            ClientConfig.parseEndpoint(builder.endpoint),
            builder.credentials,
            builder.timeout,
            builder.verifyTls);
    this.requestBuilder = new RequestBuilder(config);
    this.transport = builder.transport != null ? builder.transport : new HttpClientTransport();
  }

  /** Returns the immutable configuration of this client. */
  public ClientConfig getConfig() {
    return config;
  }

  /**
   * Lists all queues in the cluster. {@code GET /api/queues}
   *
   * @return the queues, empty if there are none, unmodifiable
   */
  public List<QueueInfo> listQueues() {
    return listOf(ResourcePath.of(QUEUES));
  }

  /**
   * Lists the queues in one virtual host. {@code GET /api/queues/{vhost}}
   *
   * @param vhost the virtual host, {@code "/"} for the default one
   * @return the queues, empty if there are none, unmodifiable
   */
  public List<QueueInfo> listQueuesIn(String vhost) {
    Objects.requireNonNull(vhost, "vhost");
    return listOf(ResourcePath.of(QUEUES, vhost));
  }

  /**
   * Returns the detailed state of one queue, including its consumers. {@code GET
   * /api/queues/{vhost}/{name}}
   *
   * @param vhost the virtual host
   * @param name the queue name
   * @return the queue snapshot
   * @throws io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestHttpException with
   *     status 404 if the queue or vhost does not exist
   */
  public QueueInfo getQueue(String vhost, String name) {
    RestRequest request = requestBuilder.build(HttpMethod.GET, queuePath(vhost, name));
    return ResponseDecoder.decode(request, send(request), QUEUE);
  }

  /**
   * Creates a queue, or confirms an existing one has the same settings. {@code PUT
   * /api/queues/{vhost}/{name}}
   *
   * <p>Declaring an existing queue with different durability or arguments is rejected by the
   * broker.
   *
   * @param vhost the virtual host
   * @param name the queue name
   * @param settings the queue settings
   * @return the response, {@code 201} when created and {@code 204} when it already existed
   */
  public TransportResponse declareQueue(String vhost, String name, QueueSettings settings) {
    Objects.requireNonNull(settings, "settings");
    String body = GSON.toJson(settings);
    RestRequest request =
        requestBuilder.build(HttpMethod.PUT, queuePath(vhost, name), Map.of(), body);
    return sendAndCheck(request);
  }

  /**
   * Deletes a queue unconditionally. {@code DELETE /api/queues/{vhost}/{name}}
   *
   * @param vhost the virtual host
   * @param name the queue name
   * @return the response
   */
  public TransportResponse deleteQueue(String vhost, String name) {
    return deleteQueue(vhost, name, QueueDeleteOptions.NONE);
  }

  /**
   * Deletes a queue if the given conditions hold. {@code DELETE /api/queues/{vhost}/{name}}
   *
   * @param vhost the virtual host
   * @param name the queue name
   * @param options the delete conditions
   * @return the response
   */
  public TransportResponse deleteQueue(String vhost, String name, QueueDeleteOptions options) {
    Objects.requireNonNull(options, "options");
    RestRequest request =
        requestBuilder.build(
            HttpMethod.DELETE, queuePath(vhost, name), options.toQueryParameters(), null);
    return sendAndCheck(request);
  }

  /**
   * Removes all ready messages from a queue, keeping the queue. {@code DELETE
   * /api/queues/{vhost}/{name}/contents}
   *
   * @param vhost the virtual host
   * @param name the queue name
   * @return the response
   */
  public TransportResponse purgeQueue(String vhost, String name) {
    RestRequest request =
        requestBuilder.build(HttpMethod.DELETE, queuePath(vhost, name).append(CONTENTS));
    return sendAndCheck(request);
  }

  private List<QueueInfo> listOf(ResourcePath path) {
    RestRequest request = requestBuilder.build(HttpMethod.GET, path);
    List<QueueInfo> queues = ResponseDecoder.decode(request, send(request), QUEUE_LIST);
    return List.copyOf(queues);
  }

  private TransportResponse sendAndCheck(RestRequest request) {
    TransportResponse response = send(request);
    ResponseDecoder.checkStatus(request, response);
    return response;
  }

  private TransportResponse send(RestRequest request) {
    LOGGER.debug("{} {}", request.method(), request.url());
    TransportResponse response = transport.execute(request, config.timeout(), config.verifyTls());
    LOGGER.debug("{} {} -> {}", request.method(), request.url(), response.statusCode());
    return response;
  }

  private static ResourcePath queuePath(String vhost, String name) {
    Objects.requireNonNull(vhost, "vhost");
    Objects.requireNonNull(name, "name");
    return ResourcePath.of(QUEUES, vhost, name);
  }

  /** Builder for {@link RabbitRestClient}. */
  public static final class Builder {

    private final String endpoint;
    private final Credentials credentials;
    private @Nullable RabbitRestTransport transport;
    private @Nullable Duration timeout = DEFAULT_TIMEOUT;
    private boolean verifyTls = true;

    /**
     * Creates a builder with the required client parameters.
     *
     * @param endpoint the management listener's base URL, e.g. {@code http://localhost:15672}
     * @param credentials the authentication credentials
     */
    public Builder(String endpoint, Credentials credentials) {
      this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
      this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /** Sets the transport implementation. Defaults to a new {@link HttpClientTransport}. */
    public Builder transport(RabbitRestTransport transport) {
      this.transport = Objects.requireNonNull(transport, "transport");
      return this;
    }

    /** Sets the request timeout. Defaults to 30 seconds. Pass {@code null} for no timeout. */
    public Builder timeout(@Nullable Duration timeout) {
      this.timeout = timeout;
      return this;
    }

    /** Sets whether to verify TLS certificates. Defaults to {@code true}. */
    public Builder verifyTls(boolean verifyTls) {
      this.verifyTls = verifyTls;
      return this;
    }

    /**
     * Builds the client.
     *
     * @return the configured client
     * @throws io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestConstructionException
     *     if the endpoint or timeout is invalid
     */
    public RabbitRestClient build() {
      return new RabbitRestClient(this);
    }
  }
}
