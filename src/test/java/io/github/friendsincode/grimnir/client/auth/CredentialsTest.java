package io.github.friendsincode.grimnir.client.auth;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CredentialsTest {

  @Test
  void apiKeyAuthImplementsCredentials() {
    assertThat(new ApiKeyAuth("gr_key")).isInstanceOf(Credentials.class);
  }

  @Test
  void bearerTokenAuthImplementsCredentials() {
    assertThat(new BearerTokenAuth("jwt")).isInstanceOf(Credentials.class);
  }

  @Test
  void sealedInterfacePermitsExactlyTwoTypes() {
    Class<?>[] permitted = Credentials.class.getPermittedSubclasses();

    assertThat(permitted).hasSize(2);
    assertThat(permitted)
        .extracting(Class::getSimpleName)
        .containsExactlyInAnyOrder("ApiKeyAuth", "BearerTokenAuth");
  }
}
