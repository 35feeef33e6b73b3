package io.github.friendsincode.grimnir.client.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Holds the active credential of one client and turns it into request headers.
 *
 * <p>The credential is swapped as a whole, never field by field. The reference is volatile so a
 * concurrent reader sees either the old or the new credential, but a client is still one logical
 * session: {@code login} and {@code refresh} must be serialized externally with other calls on the
 * same instance.
 */
public final class CredentialManager {

  static final String CONTENT_TYPE_HEADER = "Content-Type";
  static final String JSON_CONTENT_TYPE = "application/json";
  static final String AUTHORIZATION_HEADER = "Authorization";
  static final String API_KEY_HEADER = "X-API-Key";

  private volatile @Nullable Credentials credentials;

  /**
   * Creates a manager with an initial credential.
   *
   * @param credentials the initial credential, or {@code null} for an anonymous client
   */
  public CredentialManager(@Nullable Credentials credentials) {
    this.credentials = credentials;
  }

  /** Returns the active credential, or {@code null} if the client is anonymous. */
  public @Nullable Credentials current() {
    return credentials;
  }

  /**
   * Replaces the active credential.
   *
   * @param replacement the new credential, never null
   */
  public void replace(Credentials replacement) {
    this.credentials = Objects.requireNonNull(replacement, "replacement");
  }

  /**
   * Builds the header set for the next request.
   *
   * <p>Always contains {@code Content-Type: application/json}; the dispatcher removes it for
   * multipart uploads. Adds at most one authentication header.
   *
   * @return a new mutable, insertion-ordered header map
   */
  public Map<String, String> buildHeaders() {
    Map<String, String> headers = baselineHeaders();
    Credentials active = credentials;
    if (active instanceof BearerTokenAuth bearer) {
      headers.put(AUTHORIZATION_HEADER, "Bearer " + bearer.token());
    } else if (active instanceof ApiKeyAuth apiKey) {
      headers.put(API_KEY_HEADER, apiKey.key());
    }
    return headers;
  }

  /**
   * Returns the headers of an unauthenticated request.
   *
   * @return a new mutable map holding only the JSON content type
   */
  public static Map<String, String> baselineHeaders() {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put(CONTENT_TYPE_HEADER, JSON_CONTENT_TYPE);
    return headers;
  }
}
