package com.paysync.gateway;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RestClientRequestGatewayTest {
  private MockWebServer server;
  private RestClientRequestGateway gateway;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    gateway = new RestClientRequestGateway();
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void forwardsHeadersAndReturnsBody() throws InterruptedException {
    server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"orderList\":[]}"));

    RemoteResponse response = gateway.execute(RemoteRequest.get(server.url("/list?page=1").toString(),
        Map.of("Cookie", "PCID=1", "User-Agent", "Mozilla/5.0", "Accept-Encoding", "gzip, br", "Host", "evil")));

    assertThat(response.isSuccessful()).isTrue();
    assertThat(response.body()).isEqualTo("{\"orderList\":[]}");
    RecordedRequest recorded = server.takeRequest();
    assertThat(recorded.getPath()).isEqualTo("/list?page=1");
    assertThat(recorded.getHeader("Cookie")).isEqualTo("PCID=1");
    assertThat(recorded.getHeader("User-Agent")).isEqualTo("Mozilla/5.0");
    assertThat(recorded.getHeader("Accept-Encoding")).isNotEqualTo("gzip, br");
  }

  @Test
  void errorStatusIsReturnedNotThrown() {
    server.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

    RemoteResponse response = gateway.execute(RemoteRequest.get(server.url("/detail").toString(), Map.of()));

    assertThat(response.status()).isEqualTo(500);
    assertThat(response.isSuccessful()).isFalse();
    assertThat(response.body()).isEqualTo("boom");
  }

  @Test
  void followsRedirects() throws InterruptedException {
    server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", server.url("/login").toString()));
    server.enqueue(new MockResponse().setResponseCode(200).setBody("<title>login</title>"));

    RemoteResponse response = gateway.execute(RemoteRequest.get(server.url("/pc/history").toString(), Map.of()));

    assertThat(response.status()).isEqualTo(200);
    assertThat(response.body()).contains("login");
    server.takeRequest();
    assertThat(server.takeRequest().getPath()).isEqualTo("/login");
  }

  @Test
  void sendsBodyForPost() throws InterruptedException {
    server.enqueue(new MockResponse().setResponseCode(201));

    RemoteResponse response = gateway.execute(new RemoteRequest(server.url("/submit").toString(), "post",
        Map.of("Content-Type", "application/json"), "{\"a\":1}"));

    assertThat(response.status()).isEqualTo(201);
    RecordedRequest recorded = server.takeRequest();
    assertThat(recorded.getMethod()).isEqualTo("POST");
    assertThat(recorded.getBody().readUtf8()).isEqualTo("{\"a\":1}");
  }
}
