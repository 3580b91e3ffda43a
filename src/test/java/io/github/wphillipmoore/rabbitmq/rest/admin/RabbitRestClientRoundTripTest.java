package io.github.wphillipmoore.rabbitmq.rest.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

import com.google.gson.JsonPrimitive;
import io.github.wphillipmoore.rabbitmq.rest.admin.auth.BasicAuth;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestHttpException;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestTransportException;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.QueueDeleteOptions;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.QueueInfo;
import io.github.wphillipmoore.rabbitmq.rest.admin.model.QueueSettings;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Drives the client over real HTTP against {@link FakeManagementApi}. */
class RabbitRestClientRoundTripTest {

  private FakeManagementApi api;
  private RabbitRestClient client;

  @BeforeEach
  void setUp() throws IOException {
    api = new FakeManagementApi();
    client =
        new RabbitRestClient.Builder(
                api.endpoint() + "/",
                new BasicAuth(FakeManagementApi.USER, FakeManagementApi.PASSWORD))
            .timeout(Duration.ofSeconds(5))
            .build();
  }

  @AfterEach
  void tearDown() {
    api.close();
  }

  @Nested
  class Lifecycle {

    @Test
    void declareGetDeleteLeavesNoTrace() {
      QueueSettings settings =
          QueueSettings.builder().durable(true).argument("x-max-length", 100).build();

      assertThat(client.declareQueue("/", "orders", settings).statusCode()).isEqualTo(201);

      QueueInfo queue = client.getQueue("/", "orders");
      assertThat(queue.name()).isEqualTo("orders");
      assertThat(queue.vhost()).isEqualTo("/");
      assertThat(queue.toSettings()).isEqualTo(settings);
      assertThat(queue.consumerDetails()).isEmpty();

      assertThat(client.deleteQueue("/", "orders").statusCode()).isEqualTo(204);

      RabbitRestHttpException ex =
          catchThrowableOfType(
              () -> client.getQueue("/", "orders"), RabbitRestHttpException.class);
      assertThat(ex.getStatusCode()).isEqualTo(404);
      assertThat(ex.getReason()).isEqualTo("Not Found");
      assertThat(client.listQueuesIn("/")).isEmpty();
    }

    @Test
    void redeclaringWithSameSettingsIsAccepted() {
      QueueSettings settings = new QueueSettings(true, false);
      client.declareQueue("/", "orders", settings);

      assertThat(client.declareQueue("/", "orders", settings).statusCode()).isEqualTo(204);
    }

    @Test
    void redeclaringWithDifferentSettingsIsRejected() {
      client.declareQueue("/", "orders", new QueueSettings(true, false));

      RabbitRestHttpException ex =
          catchThrowableOfType(
              () -> client.declareQueue("/", "orders", new QueueSettings(false, false)),
              RabbitRestHttpException.class);

      assertThat(ex.getStatusCode()).isEqualTo(406);
      assertThat(ex.getError()).isEqualTo("precondition_failed");
    }

    @Test
    void nullArgumentsAreSentAsEmptyObject() {
      client.declareQueue("/", "orders", new QueueSettings(false, true, null));

      QueueInfo queue = client.getQueue("/", "orders");
      assertThat(queue.arguments()).isEmpty();
      assertThat(queue.autoDelete()).isTrue();
    }
  }

  @Nested
  class Vhosts {

    @Test
    void emptyVhostListsNoQueues() {
      api.addVhost("empty");

      assertThat(client.listQueuesIn("empty")).isEmpty();
    }

    @Test
    void unknownVhostIsNotFound() {
      assertThatThrownBy(() -> client.listQueuesIn("nowhere"))
          .isInstanceOf(RabbitRestHttpException.class)
          .hasMessageContaining("HTTP 404");
    }

    @ParameterizedTest
    @ValueSource(strings = {"app/prod", "a b", "100%", "plus+sign", "é"})
    void vhostNamesSurviveEscaping(String vhost) {
      api.addVhost(vhost);
      client.declareQueue(vhost, "q/1", new QueueSettings(true, false));

      QueueInfo queue = client.getQueue(vhost, "q/1");

      assertThat(queue.vhost()).isEqualTo(vhost);
      assertThat(queue.name()).isEqualTo("q/1");
      assertThat(client.listQueuesIn("/")).isEmpty();
    }

    @Test
    void listQueuesSpansVhosts() {
      api.addVhost("app/prod");
      client.declareQueue("/", "orders", new QueueSettings(true, false));
      client.declareQueue("app/prod", "orders", new QueueSettings(true, false));

      assertThat(client.listQueues())
          .extracting(QueueInfo::vhost)
          .containsExactlyInAnyOrder("/", "app/prod");
    }
  }

  @Nested
  class PurgeAndConditionalDelete {

    @Test
    void purgeEmptiesQueueButKeepsIt() {
      client.declareQueue("/", "orders", new QueueSettings(true, false));
      api.setMessages("/", "orders", 42);
      assertThat(client.getQueue("/", "orders").messages()).isEqualTo(42);

      assertThat(client.purgeQueue("/", "orders").statusCode()).isEqualTo(204);

      QueueInfo queue = client.getQueue("/", "orders");
      assertThat(queue.messages()).isZero();
      assertThat(queue.messagesReady()).isZero();
    }

    @Test
    void purgeMissingQueueIsNotFound() {
      assertThatThrownBy(() -> client.purgeQueue("/", "missing"))
          .isInstanceOf(RabbitRestHttpException.class)
          .hasMessageContaining("Object Not Found");
    }

    @Test
    void ifEmptyRefusesNonEmptyQueue() {
      client.declareQueue("/", "orders", new QueueSettings(true, false));
      api.setMessages("/", "orders", 1);

      assertThatThrownBy(
              () -> client.deleteQueue("/", "orders", new QueueDeleteOptions(true, false)))
          .isInstanceOf(RabbitRestHttpException.class)
          .hasMessageContaining("not empty");
      assertThat(client.getQueue("/", "orders").name()).isEqualTo("orders");
    }

    @Test
    void ifUnusedRefusesQueueWithConsumers() {
      client.declareQueue("/", "orders", new QueueSettings(true, false));
      api.setConsumers("/", "orders", 2);

      assertThat(client.getQueue("/", "orders").hasConsumers()).isTrue();
      assertThatThrownBy(
              () -> client.deleteQueue("/", "orders", new QueueDeleteOptions(false, true)))
          .isInstanceOf(RabbitRestHttpException.class)
          .hasMessageContaining("in use");
    }

    @Test
    void conditionsThatHoldAllowDelete() {
      client.declareQueue("/", "orders", new QueueSettings(true, false));

      client.deleteQueue("/", "orders", new QueueDeleteOptions(true, true));

      assertThat(client.listQueuesIn("/")).isEmpty();
    }
  }

  @Nested
  class Failures {

    @Test
    void wrongCredentialsAreUnauthorized() {
      RabbitRestClient intruder =
          new RabbitRestClient.Builder(api.endpoint(), new BasicAuth("guest", "wrong")).build();

      RabbitRestHttpException ex =
          catchThrowableOfType(intruder::listQueues, RabbitRestHttpException.class);

      assertThat(ex.getStatusCode()).isEqualTo(401);
      assertThat(ex.isClientError()).isTrue();
      assertThat(ex.getError()).isEqualTo("not_authorised");
    }

    @Test
    void stoppedBrokerIsTransportFailure() {
      api.close();

      assertThatThrownBy(client::listQueues).isInstanceOf(RabbitRestTransportException.class);
    }

    @Test
    void argumentValuesKeepTheirJsonTypes() {
      client.declareQueue(
          "/",
          "orders",
          QueueSettings.builder()
              .argument("x-queue-mode", "lazy")
              .argument("x-single-active-consumer", true)
              .build());

      QueueInfo queue = client.getQueue("/", "orders");

      assertThat(queue.arguments())
          .containsEntry("x-queue-mode", new JsonPrimitive("lazy"))
          .containsEntry("x-single-active-consumer", new JsonPrimitive(true));
    }
  }
}
