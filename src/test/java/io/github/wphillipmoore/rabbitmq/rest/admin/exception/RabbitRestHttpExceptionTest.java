package io.github.wphillipmoore.rabbitmq.rest.admin.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RabbitRestHttpExceptionTest {

  private static final String URL = "http://host:15672/api/queues/%2F/orders";
  private static final String BODY = "{\"error\":\"Object Not Found\",\"reason\":\"Not Found\"}";

  private static RabbitRestHttpException withStatus(int statusCode) {
    return new RabbitRestHttpException("fail", "GET", URL, statusCode, "", null, null);
  }

  @Nested
  class Construction {

    @Test
    void carriesAllFields() {
      RabbitRestHttpException ex =
          new RabbitRestHttpException(
              "fail", "GET", URL, 404, BODY, "Object Not Found", "Not Found");

      assertThat(ex.getMessage()).isEqualTo("fail");
      assertThat(ex.getMethod()).isEqualTo("GET");
      assertThat(ex.getUrl()).isEqualTo(URL);
      assertThat(ex.getStatusCode()).isEqualTo(404);
      assertThat(ex.getReasonPhrase()).isEqualTo("Not Found");
      assertThat(ex.getResponseText()).isEqualTo(BODY);
      assertThat(ex.getError()).isEqualTo("Object Not Found");
      assertThat(ex.getReason()).isEqualTo("Not Found");
    }

    @Test
    void errorAndReasonMayBeNull() {
      RabbitRestHttpException ex = withStatus(502);

      assertThat(ex.getError()).isNull();
      assertThat(ex.getReason()).isNull();
    }

    @Test
    void nullResponseTextThrows() {
      assertThatThrownBy(
              () -> new RabbitRestHttpException("fail", "GET", URL, 500, null, null, null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("responseText");
    }

    @Test
    void nullUrlThrows() {
      assertThatThrownBy(
              () -> new RabbitRestHttpException("fail", "GET", null, 500, "", null, null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("url");
    }

    @Test
    void isRabbitRestException() {
      assertThat(withStatus(500)).isInstanceOf(RabbitRestException.class);
    }
  }

  @Nested
  class Classification {

    @Test
    void notFound() {
      assertThat(withStatus(404).isNotFound()).isTrue();
      assertThat(withStatus(404).isConflict()).isFalse();
      assertThat(withStatus(404).isClientError()).isTrue();
      assertThat(withStatus(404).isServerError()).isFalse();
    }

    @Test
    void conflict() {
      assertThat(withStatus(409).isConflict()).isTrue();
      assertThat(withStatus(409).isNotFound()).isFalse();
    }

    @Test
    void serverError() {
      assertThat(withStatus(503).isServerError()).isTrue();
      assertThat(withStatus(503).isClientError()).isFalse();
    }

    @Test
    void redirectIsNeitherClientNorServerError() {
      RabbitRestHttpException ex = withStatus(301);
      assertThat(ex.isClientError()).isFalse();
      assertThat(ex.isServerError()).isFalse();
    }
  }

  @ParameterizedTest
  @CsvSource({
    "400, Bad Request",
    "401, Unauthorized",
    "404, Not Found",
    "409, Conflict",
    "500, Internal Server Error",
    "599, Unknown Status"
  })
  void reasonPhraseFor(int statusCode, String expected) {
    assertThat(RabbitRestHttpException.reasonPhraseFor(statusCode)).isEqualTo(expected);
  }
}
