package com.acme.assistant.worker.stages;

/** Registration order of the default stages. Gaps leave room for custom stages. */
public final class StageOrder {
  public static final int PAYLOAD_DECODING = 100;
  public static final int EMPTY_INPUT_GUARD = 200;
  public static final int MESSAGE_SAVER = 300;
  public static final int CONTEXT_LOADER = 400;
  public static final int MEMORY_RETRIEVAL = 500;
  public static final int SUMMARIZATION = 600;
  public static final int RESPONSE_SAVER = 800;
  public static final int RESPONSE_ROUTING = 900;
  public static final int FINALIZER = 1000;

  private StageOrder() {}
}
