package com.acme.assistant.worker.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Reply published to the output stream for the messaging bridge. */
public record OutboundResponse(
    @JsonProperty("user_id") String userId,
    @JsonProperty("response") String response,
    @JsonProperty("status") String status,
    @JsonProperty("source") String source,
    @JsonProperty("type") String type,
    @JsonProperty("metadata") Map<String, Object> metadata) {

  public static OutboundResponse success(InboundMessage inbound, String response) {
    return new OutboundResponse(
        inbound.userId(),
        response,
        "success",
        inbound.source(),
        inbound.responseType(),
        inbound.metadata());
  }
}
