package com.crossstitch.publisher.application.port;

import com.crossstitch.publisher.domain.error.ConfigurationException;

/**
 * Supplies the OAuth bearer token for the pinboard API.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TokenProvider {
  /**
   * Returns a current access token.
   *
   * @return non-blank bearer token
   * @throws ConfigurationException if no token is available
   */
  String accessToken() throws ConfigurationException;
}
