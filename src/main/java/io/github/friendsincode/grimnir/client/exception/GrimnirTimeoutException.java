package io.github.friendsincode.grimnir.client.exception;

import java.time.Duration;
import java.util.Objects;

/** Thrown when a request does not complete within the client's configured timeout. */
public final class GrimnirTimeoutException extends GrimnirException {

  private static final long serialVersionUID = 1L;

  private final String url;
  private final Duration timeout;

  /**
   * Creates a timeout exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param timeout the timeout that elapsed
   * @param cause the underlying cause
   */
  public GrimnirTimeoutException(String message, String url, Duration timeout, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /** Returns the URL that was being accessed when the timeout elapsed. */
  public String getUrl() {
    return url;
  }

  /** Returns the timeout that elapsed. */
  public Duration getTimeout() {
    return timeout;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.TIMEOUT;
  }
}
