package com.acme.assistant.worker.ports;

/** One turn of conversation as handed to the language model. */
public record ModelMessage(String role, String content) {}
