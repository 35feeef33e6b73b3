package io.github.friendsincode.grimnir.client.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class CredentialManagerTest {

  @Nested
  class BuildHeaders {

    @Test
    void apiKeyAddsApiKeyHeader() {
      CredentialManager manager = new CredentialManager(new ApiKeyAuth("gr_key"));

      assertThat(manager.buildHeaders())
          .containsExactly(
              Map.entry("Content-Type", "application/json"), Map.entry("X-API-Key", "gr_key"));
    }

    @Test
    void bearerAddsAuthorizationHeader() {
      CredentialManager manager = new CredentialManager(new BearerTokenAuth("jwt"));

      assertThat(manager.buildHeaders())
          .containsEntry("Authorization", "Bearer jwt")
          .doesNotContainKey("X-API-Key");
    }

    @Test
    void anonymousAddsNoAuthHeader() {
      CredentialManager manager = new CredentialManager(null);

      assertThat(manager.buildHeaders()).containsOnlyKeys("Content-Type");
    }

    @Test
    void returnsFreshMutableMapEachTime() {
      CredentialManager manager = new CredentialManager(new ApiKeyAuth("gr_key"));

      Map<String, String> first = manager.buildHeaders();
      first.remove("Content-Type");

      assertThat(manager.buildHeaders()).containsKey("Content-Type");
    }

    @Test
    void baselineHeadersHoldOnlyJsonContentType() {
      assertThat(CredentialManager.baselineHeaders())
          .containsExactly(Map.entry("Content-Type", "application/json"));
    }
  }

  @Nested
  class Replace {

    @Test
    void replaceSwitchesFromApiKeyToBearer() {
      CredentialManager manager = new CredentialManager(new ApiKeyAuth("gr_key"));

      manager.replace(new BearerTokenAuth("jwt"));

      assertThat(manager.current()).isEqualTo(new BearerTokenAuth("jwt"));
      assertThat(manager.buildHeaders())
          .containsEntry("Authorization", "Bearer jwt")
          .doesNotContainKey("X-API-Key");
    }

    @Test
    void replaceUpgradesAnonymousManager() {
      CredentialManager manager = new CredentialManager(null);

      manager.replace(new ApiKeyAuth("gr_key"));

      assertThat(manager.current()).isEqualTo(new ApiKeyAuth("gr_key"));
    }

    @Test
    void replaceWithNullThrowsNullPointerException() {
      CredentialManager manager = new CredentialManager(null);

      assertThatThrownBy(() -> manager.replace(null))
          .isInstanceOf(NullPointerException.class)
          .hasMessage("replacement");
    }
  }
}
