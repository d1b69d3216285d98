package com.crossstitch.publisher.infrastructure.token;

import com.crossstitch.publisher.application.port.TokenProvider;
import com.crossstitch.publisher.domain.error.ConfigurationException;
import com.crossstitch.publisher.logging.Logs;
import java.util.function.UnaryOperator;

/**
 * {@link TokenProvider} returning a token from configuration, falling back to an environment variable.
 *
 * @since 0.1.0
 */
public final class StaticTokenProvider implements TokenProvider {
  public static final String ENV_VARIABLE = "PINTEREST_ACCESS_TOKEN";

  private final String configured;
  private final UnaryOperator<String> environment;

  public StaticTokenProvider(String configured) {
    this(configured, System::getenv);
  }

  StaticTokenProvider(String configured, UnaryOperator<String> environment) {
    this.configured = configured;
    this.environment = environment;
  }

  @Override
  public String accessToken() throws ConfigurationException {
    if (configured != null && !configured.isBlank()) {
      return configured.trim();
    }
    String fromEnv = environment.apply(ENV_VARIABLE);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return fromEnv.trim();
    }
    throw new ConfigurationException(
        "No pinboard access token: set pinterest.accessToken or " + ENV_VARIABLE);
  }

  @Override
  public String toString() {
    boolean fromConfig = configured != null && !configured.isBlank();
    return "StaticTokenProvider[token=" + (fromConfig ? Logs.redact(configured) : "$" + ENV_VARIABLE) + "]";
  }
}
