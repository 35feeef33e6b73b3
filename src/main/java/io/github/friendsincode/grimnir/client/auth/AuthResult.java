package io.github.friendsincode.grimnir.client.auth;

import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Outcome of a successful login or token refresh.
 *
 * <p>The {@code user} map is an unmodifiable copy of the {@code user} object returned by login. It
 * is empty for refresh, which returns no user.
 *
 * @param token the new session token
 * @param expiresAt the token expiry, or null if the backend did not report one
 * @param user the authenticated user's profile, never null
 */
public record AuthResult(
    String token, @Nullable OffsetDateTime expiresAt, Map<String, Object> user) {

  /** Validates the token and defensively copies the user map. */
  public AuthResult {
    Objects.requireNonNull(token, "token");
    // LinkedHashMap keeps the JSON field order and tolerates null values
    user = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(user, "user")));
  }

  /** Returns the credential this result installs on the client. */
  public BearerTokenAuth toCredentials() {
    return new BearerTokenAuth(token, expiresAt);
  }
}
