package io.github.friendsincode.grimnir.client.exception;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class GrimnirTimeoutExceptionTest {

  private static final String URL = "https://radio.example.com/api/v1/stations";

  @Test
  void constructWithAllFields() {
    Throwable cause = new HttpTimeoutException("timed out");

    GrimnirTimeoutException ex =
        new GrimnirTimeoutException("slow", URL, Duration.ofSeconds(30), cause);

    assertThat(ex.getMessage()).isEqualTo("slow");
    assertThat(ex.getUrl()).isEqualTo(URL);
    assertThat(ex.getTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(ex.getCause()).isSameAs(cause);
    assertThat(ex.getKind()).isEqualTo(ErrorKind.TIMEOUT);
  }

  @Test
  void nullUrlThrowsNullPointerException() {
    assertThatThrownBy(
            () ->
                new GrimnirTimeoutException(
                    "slow", null, Duration.ofSeconds(1), new RuntimeException()))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("url");
  }

  @Test
  void nullTimeoutThrowsNullPointerException() {
    assertThatThrownBy(() -> new GrimnirTimeoutException("slow", URL, null, new RuntimeException()))
        .isInstanceOf(NullPointerException.class)
        .hasMessage("timeout");
  }
}
