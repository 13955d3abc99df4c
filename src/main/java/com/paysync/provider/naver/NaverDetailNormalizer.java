package com.paysync.provider.naver;

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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps a portal payment detail ({@code result}) to a {@link TransactionRecord}.
 * A single-product payment carries {@code product}; an order sheet carries
 * {@code productOrders}.
 */
public class NaverDetailNormalizer {
  static final String UNKNOWN_MERCHANT = "Unknown";

  private final ZoneId zone;

  public NaverDetailNormalizer(ZoneId zone) {
    this.zone = zone;
  }

  public ClassifiedPayload classify(JsonNode root) {
    JsonNode result = root == null ? null : at(root, "result");
    if (result == null || !result.isObject()) {
      return ClassifiedPayload.unrecognized();
    }
    JsonNode product = result.get("product");
    if (product != null && product.isObject()) {
      return new ClassifiedPayload(PayloadShape.SIMPLE, result);
    }
    if (hasElements(result.get("productOrders"))) {
      return new ClassifiedPayload(PayloadShape.MULTI_SUBORDER, result);
    }
    return ClassifiedPayload.unrecognized();
  }

  public Optional<TransactionRecord> normalize(JsonNode root, String payId) {
    ClassifiedPayload payload = classify(root);
    return switch (payload.shape()) {
      case SIMPLE -> build(payload.body(), payId, simpleItems(payload.body()), true);
      case MULTI_SUBORDER -> build(payload.body(), payId, orderItems(payload.body()), false);
      case UNRECOGNIZED -> Optional.empty();
    };
  }

  private Optional<TransactionRecord> build(JsonNode result, String payId, List<LineItem> items,
                                            boolean singleProduct) {
    Instant paidAt = instant(result, zone, "payment.date", "order.orderDateTime");
    if (paidAt == null) {
      return Optional.empty();
    }
    String externalId = text(result, "payment.id", "order.orderNo");
    String productName = singleProduct
        ? text(result, "product.name")
        : TransactionRecord.summarizeItems(items);
    Integer productCount = singleProduct
        ? Integer.valueOf(quantity(result, "product.count"))
        : Integer.valueOf(items.size());
    return Optional.of(TransactionRecord.builder()
        .externalId(externalId == null ? payId : externalId)
        .providerType(ProviderType.NAVER)
        .paidAt(paidAt)
        .merchant(merchant(result))
        .totalAmount(total(result))
        .discountAmount(discount(result))
        .productName(productName)
        .productCount(productCount)
        .amountDetails(amountDetails(result))
        .lineItems(items)
        .build());
  }

  private static long total(JsonNode result) {
    Long total = firstPositive(result, "amount.totalAmount", "pay.totalInitPayAmount");
    return total == null ? 0L : total;
  }

  private static Long discount(JsonNode result) {
    Long discount = longValue(result, "pay.totalDiscountAmount");
    return discount != null ? discount : longValue(result, "amount.discountAmount");
  }

  private static Merchant merchant(JsonNode result) {
    JsonNode merchant = result.get("merchant");
    String name = merchant == null ? null : text(merchant, "name");
    if (name == null) {
      name = firstBundleMerchant(result.get("productBundleGroups"));
    }
    if (merchant == null || !merchant.isObject()) {
      return Merchant.named(name == null ? UNKNOWN_MERCHANT : name);
    }
    return new Merchant(name == null ? UNKNOWN_MERCHANT : name,
        text(merchant, "tel"), text(merchant, "url"), text(merchant, "imageUrl"));
  }

  // productBundleGroups is an object keyed by bundle id.
  private static String firstBundleMerchant(JsonNode groups) {
    if (groups == null || !groups.isObject()) {
      return null;
    }
    Iterator<JsonNode> values = groups.elements();
    return values.hasNext() ? text(values.next(), "merchantName") : null;
  }

  private List<LineItem> simpleItems(JsonNode result) {
    JsonNode product = result.get("product");
    return List.of(LineItem.builder()
        .lineNo(1)
        .productName(text(product, "name"))
        .quantity(quantity(product, "count"))
        .lineAmount(total(result))
        .imageUrl(text(product, "imgUrl", "imageUrl"))
        .infoUrl(text(product, "infoUrl"))
        .build());
  }

  private static List<LineItem> orderItems(JsonNode result) {
    List<LineItem> items = new ArrayList<>();
    for (JsonNode order : result.get("productOrders")) {
      items.add(LineItem.builder()
          .lineNo(items.size() + 1)
          .productId(text(order, "productId"))
          .productName(text(order, "productName"))
          .quantity(quantity(order, "orderQuantity"))
          .unitPrice(longValue(order, "unitPrice"))
          .lineAmount(longValue(order, "orderAmount"))
          .imageUrl(text(order, "productImageUrl"))
          .memo(text(order, "optionContents"))
          .build());
    }
    return items;
  }

  private static Map<String, Long> amountDetails(JsonNode result) {
    Map<String, Long> details = new LinkedHashMap<>();
    putPositive(details, "cupDeposit", result, "amount.cupDepositAmount");
    putPositive(details, "easyCard", result, "amount.paymentMethod.easyCard");
    putPositive(details, "easyBank", result, "amount.paymentMethod.easyBank");
    putPositive(details, "rewardPoint", result, "amount.paymentMethod.rewardPoint", "pay.rewardPointPayAmount");
    putPositive(details, "chargePoint", result, "amount.paymentMethod.chargePoint", "pay.chargePointPayAmount");
    putPositive(details, "giftCard", result, "amount.paymentMethod.giftCard");
    return details;
  }

  private static void putPositive(Map<String, Long> target, String name, JsonNode node, String... paths) {
    Long value = firstPositive(node, paths);
    if (value != null) {
      target.put(name, value);
    }
  }
}
