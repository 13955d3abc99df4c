package com.paysync.provider;

import com.fasterxml.jackson.databind.JsonNode;

/** A detail payload tagged with its shape. {@code body} is the shape's root node, null when unrecognized. */
public record ClassifiedPayload(PayloadShape shape, JsonNode body) {
  public static ClassifiedPayload unrecognized() {
    return new ClassifiedPayload(PayloadShape.UNRECOGNIZED, null);
  }
}
