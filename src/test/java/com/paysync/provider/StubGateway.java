package com.paysync.provider;

import com.paysync.gateway.RemoteRequest;
import com.paysync.gateway.RemoteRequestGateway;
import com.paysync.gateway.RemoteResponse;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Answers or fails by exact URL; anything unregistered is a 404. */
public class StubGateway implements RemoteRequestGateway {
  private final Map<String, RemoteResponse> responses = new HashMap<>();
  private final Map<String, RuntimeException> failures = new HashMap<>();
  private final List<RemoteRequest> requests = new ArrayList<>();

  public StubGateway respond(String url, int status, String body) {
    responses.put(url, new RemoteResponse(status, body));
    return this;
  }

  public StubGateway fail(String url, RuntimeException failure) {
    failures.put(url, failure);
    return this;
  }

  @Override
  public RemoteResponse execute(RemoteRequest request) {
    requests.add(request);
    RuntimeException failure = failures.get(request.url());
    if (failure != null) {
      throw failure;
    }
    return responses.getOrDefault(request.url(), new RemoteResponse(404, "not found"));
  }

  public List<RemoteRequest> requests() {
    return requests;
  }
}
