package com.acme.assistant.worker.ports;

/** A long-term memory with its relevance to the current input, 0..1. */
public record Memory(String text, double score) {}
