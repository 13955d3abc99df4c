package com.paysync.provider.naver;

import com.paysync.config.NaverProperties;
import com.paysync.gateway.RemoteRequest;
import com.paysync.gateway.RemoteRequestGateway;
import com.paysync.gateway.RemoteResponse;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Payment portal history and order-detail endpoints. */
@Component
public class NaverClient {
  private static final String DEFAULT_PAY_BASE_URL = "https://pay.naver.com";
  private static final String DEFAULT_ORDERS_BASE_URL = "https://orders.pay.naver.com";
  // Service types whose detail is addressed by order number.
  private static final Set<String> ORDER_SHEET_TYPES = Set.of("LOCALPAY", "ORDER");

  private final RemoteRequestGateway gateway;
  private final String payBaseUrl;
  private final String ordersBaseUrl;

  public NaverClient(RemoteRequestGateway gateway, NaverProperties properties) {
    this.gateway = gateway;
    this.payBaseUrl = baseUrl(properties == null ? null : properties.payBaseUrl(), DEFAULT_PAY_BASE_URL);
    this.ordersBaseUrl = baseUrl(properties == null ? null : properties.ordersBaseUrl(), DEFAULT_ORDERS_BASE_URL);
  }

  public RemoteResponse historyDocument(Map<String, String> headers) {
    return gateway.execute(RemoteRequest.get(payBaseUrl + "/pc/history?page=1", headers));
  }

  public RemoteResponse historyPage(String buildToken, int page, Map<String, String> headers) {
    String url = payBaseUrl + "/_next/data/" + buildToken + "/pc/history.json?page=" + page;
    return gateway.execute(RemoteRequest.get(url, headers));
  }

  public RemoteResponse paymentDetail(String payId, String serviceType, String orderNo, Map<String, String> headers) {
    return gateway.execute(RemoteRequest.get(detailUrl(payId, serviceType, orderNo), headers));
  }

  String detailUrl(String payId, String serviceType, String orderNo) {
    if (serviceType != null && ORDER_SHEET_TYPES.contains(serviceType) && orderNo != null && !orderNo.isBlank()) {
      return ordersBaseUrl + "/orderApi/orderSheet/detail/?orderNo=" + encode(orderNo);
    }
    return ordersBaseUrl + "/orderApi/payment/detail/naverFinancial?paymentId=" + encode(payId);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
  }

  private static String baseUrl(String configured, String fallback) {
    String value = configured == null || configured.isBlank() ? fallback : configured;
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
