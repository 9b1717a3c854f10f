package com.acme.assistant.worker.web;

import com.acme.assistant.core.DeadLetterNotFoundException;
import com.acme.assistant.core.OperatorException;
import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

/**
 * Maps operator errors to HTTP: an unknown dead-letter id is 404 NOT FOUND, anything else 400 BAD
 * REQUEST.
 */
@Produces
@Singleton
@Requires(classes = {OperatorException.class, ExceptionHandler.class})
public class OperatorExceptionHandler
    implements ExceptionHandler<OperatorException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(HttpRequest request, OperatorException exception) {
    if (exception instanceof DeadLetterNotFoundException) {
      return HttpResponse.<ErrorResponse>status(HttpStatus.NOT_FOUND)
          .body(new ErrorResponse(exception.getMessage(), HttpStatus.NOT_FOUND.getCode()));
    }
    return HttpResponse.badRequest(
        new ErrorResponse(exception.getMessage(), HttpStatus.BAD_REQUEST.getCode()));
  }
}
