package com.paysync.provider.coupang;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.paysync.config.SyncProperties;
import com.paysync.gateway.RemoteResponse;
import com.paysync.ledger.TransactionRecord;
import com.paysync.model.ProviderType;
import com.paysync.provider.ProviderJson;
import com.paysync.sync.BuildTokenResolver;
import com.paysync.sync.ListingStub;
import com.paysync.sync.PageCursor;
import com.paysync.sync.PageFetchException;
import com.paysync.sync.PageListing;
import com.paysync.sync.Pagination;
import com.paysync.sync.ProviderCollector;
import com.paysync.sync.SetupException;
import com.paysync.sync.SyncSession;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

@Component
public class CoupangCollector implements ProviderCollector {
  private static final Logger log = LoggerFactory.getLogger(CoupangCollector.class);

  private final CoupangClient client;
  private final ObjectMapper objectMapper;
  private final CoupangDetailNormalizer normalizer;

  public CoupangCollector(CoupangClient client, ObjectMapper objectMapper, SyncProperties syncProperties) {
    this.client = client;
    this.objectMapper = objectMapper;
    this.normalizer = new CoupangDetailNormalizer(ZoneId.of(syncProperties.zone()));
  }

  @Override
  public ProviderType getProviderType() {
    return ProviderType.COUPANG;
  }

  @Override
  public Pagination pagination() {
    return Pagination.yearly(0);
  }

  /** The order page of any order links the current build manifest. */
  @Override
  public String resolveToken(SyncSession session) {
    RemoteResponse listing = client.listOrders(0, 0, 1, session.getHeaders());
    if (!listing.isSuccessful()) {
      throw new SetupException("Order list for build token failed: HTTP " + listing.status());
    }
    JsonNode first = ProviderJson.at(readTree(listing.body()), "orderList.0");
    String orderId = first == null ? null : ProviderJson.text(first, "orderId");
    if (orderId == null) {
      throw new SetupException("No order available to derive the build token");
    }
    RemoteResponse document = client.orderDocument(orderId, session.getHeaders());
    if (!document.isSuccessful()) {
      throw new SetupException("Order page fetch failed: HTTP " + document.status());
    }
    return BuildTokenResolver.extract(document.body(), BuildTokenResolver.NEXT_BUILD_MANIFEST)
        .orElseThrow(() -> new SetupException("Build token not found in order page"));
  }

  @Override
  public PageListing listPage(SyncSession session, PageCursor cursor) {
    RemoteResponse response;
    try {
      response = client.listOrders(cursor.year(), cursor.pageIndex(), session.getHeaders());
    } catch (RestClientException ex) {
      throw new PageFetchException("Transport failure: " + ex.getMessage(), ex);
    }
    if (!response.isSuccessful()) {
      throw new PageFetchException("HTTP " + response.status());
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(response.body() == null ? "" : response.body());
    } catch (JsonProcessingException ex) {
      throw new PageFetchException("Unreadable order list: " + ProviderJson.abbreviate(response.body()), ex);
    }
    JsonNode orders = root == null ? null : root.get("orderList");
    if (orders == null || !orders.isArray()) {
      log.warn("Order list for {} without orderList: {}", cursor.describe(), ProviderJson.abbreviate(response.body()));
      return PageListing.of(List.of());
    }
    List<ListingStub> stubs = new ArrayList<>();
    for (JsonNode order : orders) {
      String orderId = ProviderJson.text(order, "orderId");
      if (orderId == null) {
        continue;
      }
      stubs.add(new ListingStub(orderId, null, null, null, null, null, null, client.orderDocumentUrl(orderId)));
    }
    return PageListing.of(stubs);
  }

  @Override
  public Optional<TransactionRecord> fetchDetail(SyncSession session, ListingStub stub) {
    try {
      RemoteResponse response = client.orderDetail(session.getBuildToken(), stub.externalId(), session.getHeaders());
      if (!response.isSuccessful()) {
        log.warn("Order {} detail returned HTTP {}", stub.externalId(), response.status());
        return Optional.empty();
      }
      Optional<TransactionRecord> record = normalizer.normalize(objectMapper.readTree(response.body()), stub.externalId());
      if (record.isEmpty()) {
        log.warn("Order {} detail not recognized: {}", stub.externalId(), ProviderJson.abbreviate(response.body()));
      }
      return record;
    } catch (Exception ex) {
      log.warn("Order {} detail failed: {}", stub.externalId(), ex.getMessage());
      return Optional.empty();
    }
  }

  private JsonNode readTree(String body) {
    try {
      return objectMapper.readTree(body == null ? "" : body);
    } catch (JsonProcessingException ex) {
      throw new SetupException("Unreadable order list: " + ProviderJson.abbreviate(body), ex);
    }
  }
}
