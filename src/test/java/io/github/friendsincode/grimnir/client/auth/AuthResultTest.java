package io.github.friendsincode.grimnir.client.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AuthResultTest {

  private static final OffsetDateTime EXPIRY =
      OffsetDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

  @Test
  void userMapIsCopied() {
    Map<String, Object> user = new HashMap<>();
    user.put("id", "u1");

    AuthResult result = new AuthResult("jwt", EXPIRY, user);
    user.put("id", "changed");

    assertThat(result.user()).containsEntry("id", "u1");
  }

  @Test
  void userMapIsUnmodifiable() {
    AuthResult result = new AuthResult("jwt", null, Map.of("id", "u1"));

    assertThatThrownBy(() -> result.user().put("role", "admin"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void userMapKeepsNullValuesAndOrder() {
    Map<String, Object> user = new LinkedHashMap<>();
    user.put("id", "u1");
    user.put("avatar", null);
    user.put("email", "dj@example.com");

    AuthResult result = new AuthResult("jwt", null, user);

    assertThat(result.user().keySet()).containsExactly("id", "avatar", "email");
    assertThat(result.user()).containsEntry("avatar", null);
  }

  @Test
  void toCredentialsCarriesTokenAndExpiry() {
    AuthResult result = new AuthResult("jwt", EXPIRY, Map.of());

    assertThat(result.toCredentials()).isEqualTo(new BearerTokenAuth("jwt", EXPIRY));
  }

  @Test
  void nullTokenThrowsNullPointerException() {
    assertThatThrownBy(() -> new AuthResult(null, EXPIRY, Map.of()))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("token");
  }

  @Test
  void nullUserThrowsNullPointerException() {
    assertThatThrownBy(() -> new AuthResult("jwt", EXPIRY, null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("user");
  }
}
