package com.paysync.provider.coupang;

import static com.paysync.provider.ProviderJson.at;
import static com.paysync.provider.ProviderJson.firstPositive;
import static com.paysync.provider.ProviderJson.hasElements;
import static com.paysync.provider.ProviderJson.instant;
import static com.paysync.provider.ProviderJson.longValue;
import static com.paysync.provider.ProviderJson.quantity;
import static com.paysync.provider.ProviderJson.text;

import com.fasterxml.jackson.databind.JsonNode;
import com.paysync.ledger.LineItem;
import com.paysync.ledger.Merchant;
import com.paysync.ledger.TransactionRecord;
import com.paysync.model.ProviderType;
import com.paysync.provider.ClassifiedPayload;
import com.paysync.provider.PayloadShape;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps the marketplace order page data ({@code pageProps.domains}) to a
 * {@link TransactionRecord}. Orders with one delivery group are sold by a
 * single vendor; several groups make a multi-vendor order.
 */
public class CoupangDetailNormalizer {
  static final String DEFAULT_MERCHANT = "Coupang";

  private final ZoneId zone;

  public CoupangDetailNormalizer(ZoneId zone) {
    this.zone = zone;
  }

  public ClassifiedPayload classify(JsonNode root, String orderId) {
    JsonNode entity = entity(root, "pageProps.domains.order.entity.entities", orderId);
    if (entity == null || !entity.isObject()) {
      return ClassifiedPayload.unrecognized();
    }
    JsonNode groups = entity.path("deliveryGroupList");
    return groups.isArray() && groups.size() > 1
        ? new ClassifiedPayload(PayloadShape.MULTI_SUBORDER, entity)
        : new ClassifiedPayload(PayloadShape.SIMPLE, entity);
  }

  public Optional<TransactionRecord> normalize(JsonNode root, String orderId) {
    ClassifiedPayload payload = classify(root, orderId);
    JsonNode payment = entity(root, "pageProps.domains.payment.entities", orderId);
    Optional<TransactionRecord> record = switch (payload.shape()) {
      case SIMPLE -> Optional.of(build(payload.body(), payment, orderId, simpleMerchant(payload.body())));
      case MULTI_SUBORDER -> Optional.of(build(payload.body(), payment, orderId, multiMerchant(payload.body())));
      case UNRECOGNIZED -> Optional.empty();
    };
    // Without a date the record cannot be ordered against the checkpoint.
    return record.filter(value -> value.paidAt() != null);
  }

  private TransactionRecord build(JsonNode order, JsonNode payment, String orderId, Merchant merchant) {
    List<LineItem> items = lineItems(order);
    Instant paidAt = payment == null ? null : instant(payment, zone, "paidAt");
    if (paidAt == null) {
      paidAt = instant(order, zone, "orderedAt");
    }
    Long total = payment == null ? null : firstPositive(payment, "totalPayedAmount");
    if (total == null) {
      total = firstPositive(order, "totalProductPrice");
    }
    String id = text(order, "orderId");
    return TransactionRecord.builder()
        .externalId(id == null ? orderId : id)
        .providerType(ProviderType.COUPANG)
        .paidAt(paidAt)
        .merchant(merchant)
        .statusCode(statusCode(order))
        .statusText(statusText(order))
        .totalAmount(total == null ? 0L : total)
        .discountAmount(payment == null ? null : firstPositive(payment, "wowBenefit.instantDiscountPrice"))
        .productName(TransactionRecord.summarizeItems(items))
        .productCount(items.isEmpty() ? null : items.size())
        .amountDetails(amountDetails(payment))
        .lineItems(items)
        .build();
  }

  private Merchant simpleMerchant(JsonNode order) {
    JsonNode vendor = at(order, "deliveryGroupList.0.vendor");
    String name = vendor == null ? null : text(vendor, "vendorName", "name");
    if (name == null) {
      name = text(order, "title");
    }
    return new Merchant(name == null ? DEFAULT_MERCHANT : name,
        vendor == null ? null : text(vendor, "repPhoneNum"), null, null);
  }

  private Merchant multiMerchant(JsonNode order) {
    String name = text(order, "title");
    return new Merchant(name == null ? DEFAULT_MERCHANT : name,
        text(order, "deliveryGroupList.0.vendor.repPhoneNum"), null, null);
  }

  private static String statusCode(JsonNode order) {
    if (order.path("allCanceled").asBoolean(false)) {
      return "CANCELED";
    }
    return order.path("allReceipted").asBoolean(false) ? "RECEIPTED" : "ORDERED";
  }

  private static String statusText(JsonNode order) {
    return switch (statusCode(order)) {
      case "CANCELED" -> "Canceled";
      case "RECEIPTED" -> "Received";
      default -> "Ordered";
    };
  }

  private static List<LineItem> lineItems(JsonNode order) {
    List<LineItem> items = new ArrayList<>();
    JsonNode groups = order.path("deliveryGroupList");
    if (!groups.isArray()) {
      return items;
    }
    for (JsonNode group : groups) {
      JsonNode products = group.path("productList");
      if (!hasElements(products)) {
        continue;
      }
      for (JsonNode product : products) {
        int quantity = quantity(product, "quantity");
        Long unit = longValue(product, "unitPrice");
        Long combined = firstPositive(product, "combinedUnitPrice");
        Long discounted = longValue(product, "discountedUnitPrice");
        Long lineAmount = combined != null
            ? combined * quantity
            : unit == null ? null : unit * quantity;
        items.add(LineItem.builder()
            .lineNo(items.size() + 1)
            .productId(text(product, "productId"))
            .productName(text(product, "productName"))
            .quantity(quantity)
            .unitPrice(combined != null ? combined : discounted != null ? discounted : unit)
            .lineAmount(lineAmount)
            .imageUrl(text(product, "imagePath"))
            .brandName(text(product, "brandInfo.brandName"))
            .memo(text(product, "vendorItemName"))
            .build());
      }
    }
    return items;
  }

  private static Map<String, Long> amountDetails(JsonNode payment) {
    Map<String, Long> details = new LinkedHashMap<>();
    if (payment == null) {
      return details;
    }
    putPositive(details, "totalOrderAmount", payment, "totalOrderAmount");
    putPositive(details, "totalCancelAmount", payment, "totalCancelAmount");
    putPositive(details, "rocketBalance", payment, "payedPayment.rocketBalancePayment.payedPrice");
    putPositive(details, "card", payment, "payedPayment.cardPayment.payedPrice");
    putPositive(details, "coupon", payment, "payedPayment.couponPayment.payedPrice");
    putPositive(details, "coupangCash", payment, "payedPayment.coupangCashPayment.payedPrice");
    putPositive(details, "rocketBank", payment, "payedPayment.rocketBankPayment.payedPrice");
    putPositive(details, "wowInstantDiscount", payment, "wowBenefit.instantDiscountPrice");
    putPositive(details, "rewardCash", payment, "rewardCash.amount");
    return details;
  }

  private static void putPositive(Map<String, Long> target, String name, JsonNode node, String path) {
    Long value = firstPositive(node, path);
    if (value != null) {
      target.put(name, value);
    }
  }

  // Entity maps are keyed by order id as a string.
  private static JsonNode entity(JsonNode root, String mapPath, String orderId) {
    JsonNode entities = at(root, mapPath);
    if (entities == null || !entities.isObject() || orderId == null) {
      return null;
    }
    JsonNode entity = entities.get(orderId);
    return entity == null || entity.isNull() ? null : entity;
  }
}
