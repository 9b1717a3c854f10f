package com.acme.assistant;

import io.micronaut.runtime.Micronaut;

/**
 * Assistant worker: consumes inbound events from the Redis input stream, runs them through the
 * pipeline and publishes replies. Run as many instances as needed; they share one consumer group.
 */
public class WorkerApplication {
    public static void main(String[] args) {
        Micronaut.run(WorkerApplication.class, args);
    }
}
