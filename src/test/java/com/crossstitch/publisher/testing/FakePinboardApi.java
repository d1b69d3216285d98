package com.crossstitch.publisher.testing;

import com.crossstitch.publisher.application.port.PinboardApiPort;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Pinboard API double answering from a queue of canned responses; once the queue is empty every call gets the
 * default response.
 */
public final class FakePinboardApi implements PinboardApiPort {
  private final Deque<ApiResponse> responses = new ArrayDeque<>();
  private final List<Request> requests = new ArrayList<>();
  private ApiResponse fallback = new ApiResponse(201, "{\"id\":\"pin-1\"}");
  private boolean unreachable;

  public FakePinboardApi respond(int status, String body) {
    responses.add(new ApiResponse(status, body));
    return this;
  }

  public FakePinboardApi respondByDefault(int status, String body) {
    fallback = new ApiResponse(status, body);
    return this;
  }

  public FakePinboardApi unreachable() {
    this.unreachable = true;
    return this;
  }

  @Override
  public ApiResponse send(String method, String path, String jsonBody, String bearerToken) throws IOException {
    requests.add(new Request(method, path, jsonBody, bearerToken));
    if (unreachable) {
      throw new IOException("Connection refused");
    }
    return responses.isEmpty() ? fallback : responses.poll();
  }

  public List<Request> requests() {
    return List.copyOf(requests);
  }

  public record Request(String method, String path, String body, String token) {
  }
}
