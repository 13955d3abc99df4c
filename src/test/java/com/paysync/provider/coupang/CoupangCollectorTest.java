package com.paysync.provider.coupang;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paysync.config.CoupangProperties;
import com.paysync.config.SyncProperties;
import com.paysync.ledger.TransactionRecord;
import com.paysync.model.ProviderType;
import com.paysync.provider.Fixtures;
import com.paysync.provider.StubGateway;
import com.paysync.sync.CancellationToken;
import com.paysync.sync.ListingStub;
import com.paysync.sync.PageCursor;
import com.paysync.sync.PageFetchException;
import com.paysync.sync.PageListing;
import com.paysync.sync.SetupException;
import com.paysync.sync.SyncMode;
import com.paysync.sync.SyncSession;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

class CoupangCollectorTest {
  private static final String BASE = "http://coupang.test";
  private static final String BOOTSTRAP_LIST = BASE + "/ssr/api/myorders/model/page?pageIndex=0&requestYear=0&size=1";
  private static final String ORDER_PAGE = BASE + "/ssr/desktop/order/1100223344";

  private StubGateway gateway;
  private CoupangCollector collector;
  private SyncSession session;

  @BeforeEach
  void setUp() {
    gateway = new StubGateway();
    collector = new CoupangCollector(new CoupangClient(gateway, new CoupangProperties(BASE + "/", 5)),
        new ObjectMapper(), SyncProperties.defaults());
    session = new SyncSession(UUID.randomUUID(), ProviderType.COUPANG, SyncMode.INCREMENTAL, new CancellationToken());
    session.setHeaders(Map.of("cookie", "PCID=1"));
  }

  @Test
  void resolvesTokenFromFirstOrderPage() {
    gateway.respond(BOOTSTRAP_LIST, 200, Fixtures.text("coupang/order-list.json"))
        .respond(ORDER_PAGE, 200, "<script src=\"/ssr/_next/static/AbC-123/_buildManifest.js\"></script>");

    assertThat(collector.resolveToken(session)).isEqualTo("AbC-123");
    assertThat(gateway.requests()).allSatisfy(request ->
        assertThat(request.headers()).containsEntry("cookie", "PCID=1"));
  }

  @Test
  void tokenBootstrapFailsWithoutOrders() {
    gateway.respond(BOOTSTRAP_LIST, 200, "{\"orderList\":[]}");

    assertThatThrownBy(() -> collector.resolveToken(session))
        .isInstanceOf(SetupException.class)
        .hasMessageContaining("No order");
  }

  @Test
  void tokenBootstrapFailsOnHttpErrorOrMissingManifest() {
    gateway.respond(BOOTSTRAP_LIST, 401, "");
    assertThatThrownBy(() -> collector.resolveToken(session)).isInstanceOf(SetupException.class);

    gateway.respond(BOOTSTRAP_LIST, 200, Fixtures.text("coupang/order-list.json"))
        .respond(ORDER_PAGE, 200, "<html>no manifest</html>");
    assertThatThrownBy(() -> collector.resolveToken(session))
        .isInstanceOf(SetupException.class)
        .hasMessageContaining("not found");
  }

  @Test
  void listsYearPageInProviderOrder() {
    gateway.respond(BASE + "/ssr/api/myorders/model/page?pageIndex=2&requestYear=2023&size=5", 200,
        Fixtures.text("coupang/order-list.json"));

    PageListing listing = collector.listPage(session, new PageCursor(2023, 2, 9));

    assertThat(listing.stubs()).extracting(ListingStub::externalId).containsExactly("1100223344", "1100220000");
    assertThat(listing.stubs().get(0).orderDetailUrl()).isEqualTo(ORDER_PAGE);
    assertThat(listing.reportedTotalPages()).isNull();
  }

  @Test
  void listingWithoutOrderListIsEmpty() {
    gateway.respond(BASE + "/ssr/api/myorders/model/page?pageIndex=0&requestYear=2024&size=5", 200, "{}");

    assertThat(collector.listPage(session, new PageCursor(2024, 0, 1)).isEmpty()).isTrue();
  }

  @Test
  void connectionFailureWhileListingIsPageError() {
    gateway.fail(BASE + "/ssr/api/myorders/model/page?pageIndex=0&requestYear=2024&size=5",
        new ResourceAccessException("I/O error: connection reset"));

    assertThatThrownBy(() -> collector.listPage(session, new PageCursor(2024, 0, 1)))
        .isInstanceOf(PageFetchException.class)
        .hasMessageContaining("connection reset")
        .hasCauseInstanceOf(ResourceAccessException.class);
  }

  @Test
  void listingFailuresArePageErrors() {
    gateway.respond(BASE + "/ssr/api/myorders/model/page?pageIndex=0&requestYear=2024&size=5", 500, "oops")
        .respond(BASE + "/ssr/api/myorders/model/page?pageIndex=1&requestYear=2024&size=5", 200, "<html>");

    assertThatThrownBy(() -> collector.listPage(session, new PageCursor(2024, 0, 1)))
        .isInstanceOf(PageFetchException.class)
        .hasMessageContaining("500");
    assertThatThrownBy(() -> collector.listPage(session, new PageCursor(2024, 1, 2)))
        .isInstanceOf(PageFetchException.class);
  }

  @Test
  void fetchesDetailWithSessionToken() {
    session.setBuildToken("tok");
    gateway.respond(BASE + "/ssr/_next/data/tok/desktop/order/1100223344.json?orderId=1100223344", 200,
        Fixtures.text("coupang/detail-single-vendor.json"));

    Optional<TransactionRecord> record = collector.fetchDetail(session, ListingStub.of("1100223344"));

    assertThat(record).isPresent();
    assertThat(record.get().totalAmount()).isEqualTo(23800L);
  }

  @Test
  void detailFailuresAreUnavailable() {
    session.setBuildToken("tok");
    gateway.respond(BASE + "/ssr/_next/data/tok/desktop/order/1.json?orderId=1", 200, "not json");

    assertThat(collector.fetchDetail(session, ListingStub.of("1"))).isEmpty();
    assertThat(collector.fetchDetail(session, ListingStub.of("2"))).isEmpty();
  }
}
