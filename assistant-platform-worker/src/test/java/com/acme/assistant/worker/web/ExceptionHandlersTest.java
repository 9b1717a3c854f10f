package com.acme.assistant.worker.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.acme.assistant.core.DeadLetterNotFoundException;
import com.acme.assistant.core.OperatorException;
import com.acme.assistant.core.TransportException;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Exception handler Tests")
class ExceptionHandlersTest {

  private final HttpRequest<?> request = mock(HttpRequest.class);

  @Test
  @DisplayName("should map an unknown dead-letter id to 404")
  void testNotFound() {
    HttpResponse<ErrorResponse> response =
        new OperatorExceptionHandler().handle(request, new DeadLetterNotFoundException("dlq-1"));

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(response.body().message()).isEqualTo("Message not found in DLQ: dlq-1");
    assertThat(response.body().statusCode()).isEqualTo(404);
  }

  @Test
  @DisplayName("should map other operator errors to 400")
  void testOperatorError() {
    HttpResponse<ErrorResponse> response =
        new OperatorExceptionHandler().handle(request, new OperatorException("not allowed"));

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
  }

  @Test
  @DisplayName("should map bad arguments to 400")
  void testIllegalArgument() {
    HttpResponse<ErrorResponse> response =
        new IllegalArgumentExceptionHandler()
            .handle(request, new IllegalArgumentException("limit must be between 1 and 100"));

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.body().message()).isEqualTo("limit must be between 1 and 100");
  }

  @Test
  @DisplayName("should map an unreachable broker to 503")
  void testTransport() {
    HttpResponse<ErrorResponse> response =
        new TransportExceptionHandler().handle(request, new TransportException("Connection refused"));

    assertThat((Object) response.getStatus()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.body().message()).contains("Connection refused");
  }
}
