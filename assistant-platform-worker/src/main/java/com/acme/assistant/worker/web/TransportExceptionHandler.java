package com.acme.assistant.worker.web;

import com.acme.assistant.core.TransportException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/** Redis unreachable while serving an operator request: 503, the caller may retry. */
@Produces
@Singleton
@Requires(classes = {TransportException.class, ExceptionHandler.class})
public class TransportExceptionHandler
    implements ExceptionHandler<TransportException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, TransportException exception) {
    return HttpResponse.<ErrorResponse>status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(
            new ErrorResponse(
                "Broker unavailable: " + exception.getMessage(),
                HttpStatus.SERVICE_UNAVAILABLE.getCode()));
  }
}
