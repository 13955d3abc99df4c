package com.paysync.ledger;

import com.paysync.model.ProviderType;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;

/**
 * Canonical purchase record produced by the provider normalizers and written
 * to the ledger. Amounts are in the minor currency unit.
 */
@Builder(toBuilder = true)
public record TransactionRecord(
    String externalId,
    ProviderType providerType,
    Instant paidAt,
    Merchant merchant,
    String statusCode,
    String statusText,
    String statusColor,
    long totalAmount,
    Long discountAmount,
    String productName,
    Integer productCount,
    String productDetailUrl,
    String orderDetailUrl,
    Map<String, Long> amountDetails,
    List<LineItem> lineItems
) {
  public TransactionRecord {
    if (totalAmount < 0) {
      throw new IllegalArgumentException("totalAmount must not be negative, got " + totalAmount);
    }
    lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    for (int i = 0; i < lineItems.size(); i++) {
      if (lineItems.get(i).lineNo() != i + 1) {
        throw new IllegalArgumentException("lineNo gap at position " + (i + 1));
      }
    }
    amountDetails = amountDetails == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(amountDetails));
  }

  /** First item's thumbnail, falling back to the merchant image. */
  public String thumbnailUrl() {
    for (LineItem item : lineItems) {
      if (item.imageUrl() != null && !item.imageUrl().isBlank()) {
        return item.imageUrl();
      }
    }
    return merchant == null ? null : merchant.imageUrl();
  }

  public String displayName() {
    if (productName != null && !productName.isBlank()) {
      return productName;
    }
    return merchant == null ? externalId : merchant.name();
  }

  public static String summarizeItems(List<LineItem> items) {
    if (items == null || items.isEmpty()) {
      return null;
    }
    String first = items.get(0).productName();
    return items.size() > 1 ? first + " and " + (items.size() - 1) + " more" : first;
  }
}
