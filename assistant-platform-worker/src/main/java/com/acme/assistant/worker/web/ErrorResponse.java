package com.acme.assistant.worker.web;

/** Body returned by the global exception handlers. */
public record ErrorResponse(String message, int statusCode) {}
