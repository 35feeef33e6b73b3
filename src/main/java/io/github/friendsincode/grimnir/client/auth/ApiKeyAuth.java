package io.github.friendsincode.grimnir.client.auth;

import java.util.Objects;

/**
 * Static API key credentials, sent as an {@code X-API-Key} header on every call.
 *
 * <p>Keys are generated from the user's profile page in the Grimnir web dashboard.
 *
 * @param key the API key, never null or blank
 */
public record ApiKeyAuth(String key) implements Credentials {

  /** Validates that the key is non-null and non-blank. */
  public ApiKeyAuth {
    Objects.requireNonNull(key, "key");
    if (key.isBlank()) {
      throw new IllegalArgumentException("key must not be blank");
    }
  }

  @Override
  public String toString() {
    return "ApiKeyAuth[key=***]";
  }
}
