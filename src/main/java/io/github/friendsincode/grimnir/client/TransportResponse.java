package io.github.friendsincode.grimnir.client;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * Status, body and headers of one HTTP exchange, as returned by a {@link GrimnirTransport}.
 *
 * <p>A missing body is stored as the empty string. Header names compare case-insensitively, as
 * HTTP requires.
 *
 * @param statusCode the HTTP status code
 * @param body the response body text, never null
 * @param headers the response headers, unmodifiable, case-insensitive keys
 */
public record TransportResponse(int statusCode, String body, Map<String, String> headers) {

  /** Normalizes the body and copies the headers. */
  public TransportResponse(int statusCode, @Nullable String body, Map<String, String> headers) {
    this.statusCode = statusCode;
    this.body = body != null ? body : "";
    Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    copy.putAll(Objects.requireNonNull(headers, "headers"));
    this.headers = Collections.unmodifiableMap(copy);
  }

  /**
   * Returns one header value.
   *
   * @param name the header name, in any case
   * @return the value, or {@code null} if the header is absent
   */
  public @Nullable String header(String name) {
    return headers.get(name);
  }
}
