package io.github.friendsincode.grimnir.client.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import org.junit.jupiter.api.Test;

class GrimnirConnectionExceptionTest {

  private static final String URL = "https://radio.example.com/api/v1/health";

  @Test
  void constructWithoutCause() {
    GrimnirConnectionException ex = new GrimnirConnectionException("down", URL);

    assertThat(ex.getMessage()).isEqualTo("down");
    assertThat(ex.getUrl()).isEqualTo(URL);
    assertThat(ex.getCause()).isNull();
    assertThat(ex.getKind()).isEqualTo(ErrorKind.CONNECTION);
  }

  @Test
  void constructWithCause() {
    IOException cause = new IOException("refused");

    GrimnirConnectionException ex = new GrimnirConnectionException("down", URL, cause);

    assertThat(ex.getCause()).isSameAs(cause);
  }

  @Test
  void nullUrlThrowsWithoutCause() {
    assertThatThrownBy(() -> new GrimnirConnectionException("down", null))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("url");
  }

  @Test
  void nullUrlThrowsWithCause() {
    assertThatThrownBy(() -> new GrimnirConnectionException("down", null, new IOException()))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("url");
  }
}
