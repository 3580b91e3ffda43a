package io.github.wphillipmoore.rabbitmq.rest.admin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.wphillipmoore.rabbitmq.rest.admin.auth.BasicAuth;
import io.github.wphillipmoore.rabbitmq.rest.admin.exception.RabbitRestConstructionException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ClientConfigTest {

  private static final BasicAuth AUTH = new BasicAuth("guest", "guest");

  @Nested
  class EndpointParsing {

    @Test
    void stripsTrailingSlashes() {
      assertThat(ClientConfig.parseEndpoint("http://localhost:15672///"))
          .isEqualTo(URI.create("http://localhost:15672"));
    }

    @Test
    void keepsPathPrefix() {
      ClientConfig config =
          new ClientConfig(
              ClientConfig.parseEndpoint("https://mq.example.com/rabbitmq/"), AUTH, null, true);

      assertThat(config.apiRoot()).isEqualTo("https://mq.example.com/rabbitmq/api/");
    }

    @Test
    void uppercaseSchemeIsAccepted() {
      assertThat(ClientConfig.parseEndpoint("HTTP://localhost:15672").getHost())
          .isEqualTo("localhost");
    }

    @ParameterizedTest
    @ValueSource(
        strings = {
          "localhost:15672",
          "ftp://localhost:15672",
          "http:///api",
          "http://localhost:15672/?x=1",
          "http://localhost:15672/#top",
          "/relative/path"
        })
    void invalidEndpointsAreRejected(String endpoint) {
      assertThatThrownBy(() -> ClientConfig.parseEndpoint(endpoint))
          .isInstanceOf(RabbitRestConstructionException.class);
    }

    @Test
    void underscoreHostNameIsRejectedWithExplanation() {
      assertThatThrownBy(() -> ClientConfig.parseEndpoint("http://rabbit_mq:15672"))
          .isInstanceOf(RabbitRestConstructionException.class)
          .hasMessage(
              "Endpoint URL host is not a valid host name (underscores are not allowed): "
                  + "rabbit_mq:15672");
    }

    @Test
    void missingHostIsReportedAsSuch() {
      assertThatThrownBy(() -> ClientConfig.parseEndpoint("http:///api"))
          .isInstanceOf(RabbitRestConstructionException.class)
          .hasMessageStartingWith("Endpoint URL has no host");
    }

    @Test
    void malformedEndpointKeepsCause() {
      assertThatThrownBy(() -> ClientConfig.parseEndpoint("http://local host:15672"))
          .isInstanceOf(RabbitRestConstructionException.class)
          .hasMessageStartingWith("Malformed endpoint URL")
          .hasCauseInstanceOf(URISyntaxException.class);
    }
  }

  @Nested
  class Timeout {

    @Test
    void nullTimeoutMeansNoTimeout() {
      ClientConfig config =
          new ClientConfig(URI.create("http://localhost:15672"), AUTH, null, true);

      assertThat(config.timeout()).isNull();
    }

    @Test
    void zeroTimeoutIsRejected() {
      assertThatThrownBy(
              () ->
                  new ClientConfig(
                      URI.create("http://localhost:15672"), AUTH, Duration.ZERO, true))
          .isInstanceOf(RabbitRestConstructionException.class)
          .hasMessageContaining("Timeout must be positive");
    }

    @Test
    void negativeTimeoutIsRejected() {
      assertThatThrownBy(
              () ->
                  new ClientConfig(
                      URI.create("http://localhost:15672"), AUTH, Duration.ofSeconds(-1), true))
          .isInstanceOf(RabbitRestConstructionException.class);
    }
  }

  @Test
  void nullCredentialsThrowNullPointerException() {
    assertThatThrownBy(
            () -> new ClientConfig(URI.create("http://localhost:15672"), null, null, true))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("credentials");
  }
}
