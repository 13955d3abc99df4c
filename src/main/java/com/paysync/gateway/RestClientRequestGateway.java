package com.paysync.gateway;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;

@Component
public class RestClientRequestGateway implements RemoteRequestGateway {
  private static final Logger log = LoggerFactory.getLogger(RestClientRequestGateway.class);
  // Restricted by the JDK client, or (accept-encoding) would yield a body we cannot decode.
  private static final Set<String> SKIPPED_HEADERS = Set.of(
      "host", "connection", "content-length", "expect", "upgrade", "accept-encoding");

  private final RestClient restClient;

  public RestClientRequestGateway() {
    HttpClient httpClient = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    this.restClient = RestClient.builder()
        .requestFactory(new JdkClientHttpRequestFactory(httpClient))
        .build();
  }

  @Override
  public RemoteResponse execute(RemoteRequest request) {
    HttpMethod method = HttpMethod.valueOf(request.method() == null
        ? "GET"
        : request.method().toUpperCase(Locale.ROOT));
    RestClient.RequestBodySpec spec = restClient.method(method)
        .uri(URI.create(request.url()))
        .headers(headers -> copyHeaders(request.headers(), headers));
    if (request.body() != null) {
      spec = spec.body(request.body());
    }
    RemoteResponse response = spec.exchange((clientRequest, clientResponse) -> new RemoteResponse(
        clientResponse.getStatusCode().value(),
        StreamUtils.copyToString(clientResponse.getBody(), StandardCharsets.UTF_8)));
    log.debug("{} {} -> {} ({} chars)", method, request.url(), response.status(),
        response.body() == null ? 0 : response.body().length());
    return response;
  }

  private static void copyHeaders(Map<String, String> source, HttpHeaders target) {
    if (source == null) {
      return;
    }
    source.forEach((name, value) -> {
      if (name == null || value == null || SKIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
        return;
      }
      target.set(name, value);
    });
  }
}
