package io.github.friendsincode.grimnir.client.auth;

import java.time.OffsetDateTime;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Session bearer token obtained from {@code POST /auth/login}, sent as {@code Authorization:
 * Bearer <token>}.
 *
 * <p>The expiry is informational only. The client never checks it before a call and never
 * refreshes on its own.
 *
 * @param token the session token, never null or blank
 * @param expiresAt when the backend says the token expires, or null if it did not say
 */
public record BearerTokenAuth(String token, @Nullable OffsetDateTime expiresAt)
    implements Credentials {

  /** Validates that the token is non-null and non-blank. expiresAt may be null. */
  public BearerTokenAuth {
    Objects.requireNonNull(token, "token");
    if (token.isBlank()) {
      throw new IllegalArgumentException("token must not be blank");
    }
  }

  /**
   * Creates a bearer credential without a known expiry.
   *
   * @param token the session token, never null or blank
   */
  public BearerTokenAuth(String token) {
    this(token, null);
  }

  @Override
  public String toString() {
    return "BearerTokenAuth[token=***, expiresAt=" + expiresAt + "]";
  }
}
