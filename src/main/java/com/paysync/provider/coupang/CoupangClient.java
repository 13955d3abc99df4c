package com.paysync.provider.coupang;

import com.paysync.config.CoupangProperties;
import com.paysync.gateway.RemoteRequest;
import com.paysync.gateway.RemoteRequestGateway;
import com.paysync.gateway.RemoteResponse;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Marketplace order-history endpoints. Responses are returned as-is; status handling is the caller's. */
@Component
public class CoupangClient {
  private static final String DEFAULT_BASE_URL = "https://mc.coupang.com";
  private static final int DEFAULT_PAGE_SIZE = 5;

  private final RemoteRequestGateway gateway;
  private final String baseUrl;
  private final int pageSize;

  public CoupangClient(RemoteRequestGateway gateway, CoupangProperties properties) {
    this.gateway = gateway;
    String configured = properties == null ? null : properties.baseUrl();
    this.baseUrl = stripTrailingSlash(configured == null || configured.isBlank() ? DEFAULT_BASE_URL : configured);
    this.pageSize = properties == null || properties.pageSize() == null || properties.pageSize() < 1
        ? DEFAULT_PAGE_SIZE
        : properties.pageSize();
  }

  public RemoteResponse listOrders(int year, int pageIndex, Map<String, String> headers) {
    return listOrders(year, pageIndex, pageSize, headers);
  }

  public RemoteResponse listOrders(int year, int pageIndex, int size, Map<String, String> headers) {
    String url = String.format("%s/ssr/api/myorders/model/page?pageIndex=%d&requestYear=%d&size=%d",
        baseUrl, pageIndex, year, size);
    return gateway.execute(RemoteRequest.get(url, headers));
  }

  public RemoteResponse orderDocument(String orderId, Map<String, String> headers) {
    return gateway.execute(RemoteRequest.get(orderDocumentUrl(orderId), headers));
  }

  public RemoteResponse orderDetail(String buildToken, String orderId, Map<String, String> headers) {
    String url = baseUrl + "/ssr/_next/data/" + buildToken + "/desktop/order/" + orderId + ".json?orderId=" + orderId;
    return gateway.execute(RemoteRequest.get(url, headers));
  }

  public String orderDocumentUrl(String orderId) {
    return baseUrl + "/ssr/desktop/order/" + orderId;
  }

  private static String stripTrailingSlash(String value) {
    return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
  }
}
