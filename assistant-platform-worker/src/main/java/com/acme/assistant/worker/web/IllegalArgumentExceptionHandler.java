package com.acme.assistant.worker.web;

import io.micronaut.context.annotation.Requires;
import io.micronaut.http.HttpRequest;
import io.micronaut.http.HttpResponse;
import io.micronaut.http.HttpStatus;
import io.micronaut.http.annotation.Produces;
import io.micronaut.http.server.exceptions.ExceptionHandler;
import jakarta.inject.Singleton;

@Produces
@Singleton
@Requires(classes = {IllegalArgumentException.class, ExceptionHandler.class})
public class IllegalArgumentExceptionHandler
    implements ExceptionHandler<IllegalArgumentException, HttpResponse<ErrorResponse>> {

  @Override
  public HttpResponse<ErrorResponse> handle(
      HttpRequest request, IllegalArgumentException exception) {
    String message = exception.getMessage();
    return HttpResponse.badRequest(
        new ErrorResponse(
            message != null ? message : "Invalid argument", HttpStatus.BAD_REQUEST.getCode()));
  }
}
