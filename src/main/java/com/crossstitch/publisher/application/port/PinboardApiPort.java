package com.crossstitch.publisher.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Port over the pinboard REST API.
 * <p><strong>Role:</strong> Transport only. Callers build JSON payloads and interpret status codes; the adapter
 * never throws for non-success HTTP statuses.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface PinboardApiPort {
  /**
   * Sends one authenticated request.
   *
   * @param method HTTP method ({@code GET}, {@code POST}, {@code PATCH})
   * @param path API path relative to the base URL, starting with {@code /}
   * @param jsonBody request body, or {@code null} for none
   * @param bearerToken OAuth access token
   * @return status and body as returned by the API
   * @throws IOException on transport failure
   * @throws InterruptedException if interrupted while waiting for the response
   */
  ApiResponse send(String method, String path, String jsonBody, String bearerToken)
      throws IOException, InterruptedException;

  /**
   * Raw API response.
   *
   * @param status HTTP status code
   * @param body response body; empty when the API returned none
   */
  record ApiResponse(int status, String body) {
    public ApiResponse {
      body = body == null ? "" : body;
    }

    public boolean isSuccess() {
      return status >= 200 && status < 300;
    }
  }
}
