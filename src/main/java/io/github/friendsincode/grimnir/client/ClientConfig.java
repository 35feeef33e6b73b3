package io.github.friendsincode.grimnir.client;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable connection settings of a {@link GrimnirClient}.
 *
 * @param baseUrl the instance URL (e.g. {@code https://radio.example.com}), trailing slashes
 *     stripped
 * @param apiPathPrefix the versioned API prefix, always {@value #API_PATH_PREFIX}
 * @param timeout the bound applied to every call
 */
public record ClientConfig(String baseUrl, String apiPathPrefix, Duration timeout) {

  /** Path prefix of the versioned REST API. */
  public static final String API_PATH_PREFIX = "/api/v1";

  /** Timeout used when none is configured. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

  /** Validates fields and normalizes the base URL. */
  public ClientConfig {
    baseUrl = stripTrailingSlashes(Objects.requireNonNull(baseUrl, "baseUrl"));
    if (baseUrl.isEmpty()) {
      throw new IllegalArgumentException("baseUrl must not be empty");
    }
    requireHttpUrl(baseUrl);
    Objects.requireNonNull(apiPathPrefix, "apiPathPrefix");
    if (!API_PATH_PREFIX.equals(apiPathPrefix)) {
      throw new IllegalArgumentException("apiPathPrefix must be " + API_PATH_PREFIX);
    }
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  /**
   * Creates a configuration with the fixed API prefix.
   *
   * @param baseUrl the instance URL
   * @param timeout the bound applied to every call
   * @return the configuration
   */
  public static ClientConfig of(String baseUrl, Duration timeout) {
    return new ClientConfig(baseUrl, API_PATH_PREFIX, timeout);
  }

  /** Returns {@code baseUrl + apiPathPrefix + path}. */
  public String resolve(String path) {
    return baseUrl + apiPathPrefix + path;
  }

  private static void requireHttpUrl(String url) {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("baseUrl is not a valid URL: " + url, e);
    }
    String scheme = uri.getScheme();
    if (!("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
        || uri.getHost() == null) {
      throw new IllegalArgumentException("baseUrl must be an absolute http or https URL: " + url);
    }
  }

  private static String stripTrailingSlashes(String url) {
    while (url.endsWith("/")) {
      url = url.substring(0, url.length() - 1);
    }
    return url;
  }
}
