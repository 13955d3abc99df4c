package com.paysync.provider.naver;

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
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;

@Component
public class NaverCollector implements ProviderCollector {
  private static final Logger log = LoggerFactory.getLogger(NaverCollector.class);
  private static final Pattern CDN_BUILD_MANIFEST =
      Pattern.compile("financial\\.pstatic\\.net/naverpay-web/[^/]+/_next/static/([^/]+)/_buildManifest\\.js");
  static final String LOGIN_PAGE_MARKER = "네이버 : 로그인";
  private static final String PAGE_PATH = "pageProps.dehydratedState.queries.0.state.data.pages.0";

  private final NaverClient client;
  private final ObjectMapper objectMapper;
  private final NaverDetailNormalizer normalizer;

  public NaverCollector(NaverClient client, ObjectMapper objectMapper, SyncProperties syncProperties) {
    this.client = client;
    this.objectMapper = objectMapper;
    this.normalizer = new NaverDetailNormalizer(ZoneId.of(syncProperties.zone()));
  }

  @Override
  public ProviderType getProviderType() {
    return ProviderType.NAVER;
  }

  @Override
  public Pagination pagination() {
    return Pagination.flat(1);
  }

  @Override
  public String resolveToken(SyncSession session) {
    RemoteResponse document = client.historyDocument(session.getHeaders());
    if (!document.isSuccessful()) {
      throw new SetupException("History page fetch failed: HTTP " + document.status());
    }
    String html = document.body() == null ? "" : document.body();
    if (html.contains(LOGIN_PAGE_MARKER)) {
      throw new SetupException("Redirected to the login page, stored session has expired");
    }
    return BuildTokenResolver.extract(html, CDN_BUILD_MANIFEST, BuildTokenResolver.NEXT_BUILD_MANIFEST)
        .orElseThrow(() -> new SetupException("Build token not found in history page"));
  }

  @Override
  public PageListing listPage(SyncSession session, PageCursor cursor) {
    RemoteResponse response;
    try {
      response = client.historyPage(session.getBuildToken(), cursor.pageIndex(), session.getHeaders());
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
      throw new PageFetchException("Unreadable history page: " + ProviderJson.abbreviate(response.body()), ex);
    }
    JsonNode page = ProviderJson.at(root, PAGE_PATH);
    if (page == null) {
      log.warn("History {} without page data: {}", cursor.describe(), ProviderJson.abbreviate(response.body()));
      return PageListing.of(List.of());
    }
    List<ListingStub> stubs = new ArrayList<>();
    JsonNode items = page.path("items");
    if (items.isArray()) {
      for (JsonNode item : items) {
        ListingStub stub = toStub(item);
        if (stub != null) {
          stubs.add(stub);
        }
      }
    }
    Long totalPages = ProviderJson.longValue(page, "totalPage");
    return new PageListing(stubs, totalPages == null ? null : totalPages.intValue());
  }

  @Override
  public Optional<TransactionRecord> fetchDetail(SyncSession session, ListingStub stub) {
    try {
      RemoteResponse response = client.paymentDetail(stub.externalId(), stub.subType(), stub.secondaryId(),
          session.getHeaders());
      if (!response.isSuccessful()) {
        log.warn("Payment {} detail returned HTTP {}", stub.externalId(), response.status());
        return Optional.empty();
      }
      Optional<TransactionRecord> record = normalizer.normalize(objectMapper.readTree(response.body()), stub.externalId());
      if (record.isEmpty()) {
        log.warn("Payment {} detail not recognized: {}", stub.externalId(), ProviderJson.abbreviate(response.body()));
      }
      return record;
    } catch (Exception ex) {
      log.warn("Payment {} detail failed: {}", stub.externalId(), ex.getMessage());
      return Optional.empty();
    }
  }

  // The stored payment id keys the checkpoint; the list item id is only a fallback.
  private static ListingStub toStub(JsonNode item) {
    String payId = ProviderJson.text(item, "additionalData.payId", "_id");
    if (payId == null) {
      return null;
    }
    return new ListingStub(
        payId,
        ProviderJson.text(item, "serviceType"),
        ProviderJson.text(item, "additionalData.orderNo"),
        ProviderJson.text(item, "status.name"),
        ProviderJson.text(item, "status.text"),
        ProviderJson.text(item, "status.color"),
        ProviderJson.text(item, "productDetailUrl"),
        ProviderJson.text(item, "orderDetailUrl"));
  }
}
