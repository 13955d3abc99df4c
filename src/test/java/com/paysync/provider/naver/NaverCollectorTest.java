package com.paysync.provider.naver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.paysync.config.NaverProperties;
import com.paysync.config.SyncProperties;
import com.paysync.gateway.RemoteRequest;
import com.paysync.ledger.LedgerGateway;
import com.paysync.model.ProviderType;
import com.paysync.provider.Fixtures;
import com.paysync.provider.StubGateway;
import com.paysync.sync.BuildTokenResolver;
import com.paysync.sync.CancellationToken;
import com.paysync.sync.CheckpointResolver;
import com.paysync.sync.CollectionMonitor;
import com.paysync.sync.FailureKind;
import com.paysync.sync.ListingStub;
import com.paysync.sync.PageCursor;
import com.paysync.sync.PageFetchException;
import com.paysync.sync.PageListing;
import com.paysync.sync.ProgressEvent;
import com.paysync.sync.SetupException;
import com.paysync.sync.SyncMode;
import com.paysync.sync.SyncOrchestrator;
import com.paysync.sync.SyncOutcome;
import com.paysync.sync.SyncReport;
import com.paysync.sync.SyncSession;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

class NaverCollectorTest {
  private static final String PAY = "http://pay.test";
  private static final String ORDERS = "http://orders.test";

  private StubGateway gateway;
  private NaverCollector collector;
  private SyncSession session;

  @BeforeEach
  void setUp() {
    gateway = new StubGateway();
    collector = new NaverCollector(new NaverClient(gateway, new NaverProperties(PAY, ORDERS)),
        new ObjectMapper(), SyncProperties.defaults());
    session = new SyncSession(UUID.randomUUID(), ProviderType.NAVER, SyncMode.INCREMENTAL, new CancellationToken());
  }

  @Test
  void prefersCdnQualifiedManifest() {
    gateway.respond(PAY + "/pc/history?page=1", 200,
        "<script src=\"/_next/static/local/_buildManifest.js\"></script>"
            + "<script src=\"https://financial.pstatic.net/naverpay-web/2024/_next/static/Cdn_77/_buildManifest.js\">");

    assertThat(collector.resolveToken(session)).isEqualTo("Cdn_77");
  }

  @Test
  void fallsBackToGenericManifest() {
    gateway.respond(PAY + "/pc/history?page=1", 200, "<script src=\"/_next/static/local-9/_buildManifest.js\">");

    assertThat(collector.resolveToken(session)).isEqualTo("local-9");
  }

  @Test
  void loginPageMeansExpiredSession() {
    gateway.respond(PAY + "/pc/history?page=1", 200, "<title>" + NaverCollector.LOGIN_PAGE_MARKER + "</title>");

    assertThatThrownBy(() -> collector.resolveToken(session))
        .isInstanceOf(SetupException.class)
        .hasMessageContaining("login");
  }

  @Test
  void listsHistoryPageAndReportsPageCount() {
    session.setBuildToken("tok");
    gateway.respond(PAY + "/_next/data/tok/pc/history.json?page=3", 200, Fixtures.text("naver/history-page.json"));

    PageListing listing = collector.listPage(session, new PageCursor(null, 3, 3));

    assertThat(listing.reportedTotalPages()).isEqualTo(12);
    assertThat(listing.stubs()).extracting(ListingStub::externalId).containsExactly("20240510NP1234567", "list-2");
    ListingStub first = listing.stubs().get(0);
    assertThat(first.statusCode()).isEqualTo("PAYMENT_COMPLETED");
    assertThat(first.statusText()).isEqualTo("Paid");
    assertThat(first.statusColor()).isEqualTo("GREEN");
    assertThat(first.productDetailUrl()).isEqualTo("https://shop.example.test/p/1");
    ListingStub second = listing.stubs().get(1);
    assertThat(second.subType()).isEqualTo("ORDER");
    assertThat(second.secondaryId()).isEqualTo("2024042012345678");
  }

  @Test
  void pageWithoutDataIsEmptyAndHttpErrorIsPageError() {
    session.setBuildToken("tok");
    gateway.respond(PAY + "/_next/data/tok/pc/history.json?page=1", 200, "{\"pageProps\":{}}")
        .respond(PAY + "/_next/data/tok/pc/history.json?page=2", 502, "");

    assertThat(collector.listPage(session, new PageCursor(null, 1, 1)).isEmpty()).isTrue();
    assertThatThrownBy(() -> collector.listPage(session, new PageCursor(null, 2, 2)))
        .isInstanceOf(PageFetchException.class);
  }

  @Test
  void connectionFailureWhileListingIsPageError() {
    session.setBuildToken("tok");
    gateway.fail(PAY + "/_next/data/tok/pc/history.json?page=1", new ResourceAccessException("I/O error: connection reset"));

    assertThatThrownBy(() -> collector.listPage(session, new PageCursor(null, 1, 1)))
        .isInstanceOf(PageFetchException.class)
        .hasMessageContaining("connection reset")
        .hasCauseInstanceOf(ResourceAccessException.class);
  }

  @Test
  void runContinuesPastPageWhoseConnectionFailed() {
    gateway.respond(PAY + "/pc/history?page=1", 200, "<script src=\"/_next/static/tok/_buildManifest.js\">")
        .fail(PAY + "/_next/data/tok/pc/history.json?page=1", new ResourceAccessException("I/O error: connection reset"))
        .respond(PAY + "/_next/data/tok/pc/history.json?page=2", 200, Fixtures.text("naver/history-page.json"))
        .respond(PAY + "/_next/data/tok/pc/history.json?page=3", 200, "{\"pageProps\":{}}");
    LedgerGateway ledger = mock(LedgerGateway.class);
    when(ledger.getCheckpoint(any(), any())).thenReturn(Optional.empty());
    SyncOrchestrator orchestrator = new SyncOrchestrator(id -> Map.of("cookie", "NID_SES=1"),
        new CheckpointResolver(ledger), new BuildTokenResolver(), ledger, (min, max) -> { },
        SyncProperties.defaults(), Clock.systemUTC());
    CollectionMonitor monitor = new CollectionMonitor(100, Clock.systemUTC());

    SyncReport report = orchestrator.run(collector, session, monitor);

    assertThat(report.outcome()).isEqualTo(SyncOutcome.STOPPED_NO_MORE_DATA);
    assertThat(gateway.requests()).extracting(RemoteRequest::url)
        .contains(PAY + "/_next/data/tok/pc/history.json?page=2", PAY + "/_next/data/tok/pc/history.json?page=3");
    assertThat(report.progress().total()).isEqualTo(2);
    assertThat(monitor.snapshot().events()).extracting(ProgressEvent::failureKind)
        .contains(FailureKind.PAGE_ERROR)
        .doesNotContain(FailureKind.SETUP_ERROR);
  }

  @Test
  void orderSheetStubsUseOrderNumberEndpoint() {
    gateway.respond(ORDERS + "/orderApi/orderSheet/detail/?orderNo=2024042012345678", 200,
        Fixtures.text("naver/detail-product-orders.json"));
    ListingStub stub = new ListingStub("list-2", "ORDER", "2024042012345678", null, null, null, null, null);

    assertThat(collector.fetchDetail(session, stub)).isPresent();
  }

  @Test
  void paymentStubsUsePaymentIdEndpoint() {
    gateway.respond(ORDERS + "/orderApi/payment/detail/naverFinancial?paymentId=20240510NP1234567", 200,
        Fixtures.text("naver/detail-single-product.json"));
    ListingStub stub = new ListingStub("20240510NP1234567", "SIMPLE_PAY", null, null, null, null, null, null);

    assertThat(collector.fetchDetail(session, stub)).hasValueSatisfying(record ->
        assertThat(record.merchant().name()).isEqualTo("Corner Bakery"));
  }

  @Test
  void localPayWithoutOrderNumberFallsBackToPaymentId() {
    NaverClient client = new NaverClient(gateway, new NaverProperties(PAY, ORDERS));

    assertThat(client.detailUrl("pay-1", "LOCALPAY", null))
        .isEqualTo(ORDERS + "/orderApi/payment/detail/naverFinancial?paymentId=pay-1");
    assertThat(client.detailUrl("pay-1", "LOCALPAY", "77"))
        .isEqualTo(ORDERS + "/orderApi/orderSheet/detail/?orderNo=77");
  }

  @Test
  void failedDetailIsUnavailable() {
    gateway.respond(ORDERS + "/orderApi/payment/detail/naverFinancial?paymentId=x", 500, "");

    assertThat(collector.fetchDetail(session, ListingStub.of("x"))).isEmpty();
  }
}
