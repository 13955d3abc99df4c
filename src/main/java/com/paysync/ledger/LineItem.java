package com.paysync.ledger;

import lombok.Builder;

@Builder(toBuilder = true)
public record LineItem(
    int lineNo,
    String productId,
    String productName,
    int quantity,
    Long unitPrice,
    Long lineAmount,
    String imageUrl,
    String infoUrl,
    String brandName,
    String memo
) {
  public LineItem {
    if (lineNo < 1) {
      throw new IllegalArgumentException("lineNo must start at 1, got " + lineNo);
    }
    if (quantity < 1) {
      throw new IllegalArgumentException("quantity must be at least 1, got " + quantity);
    }
  }
}
