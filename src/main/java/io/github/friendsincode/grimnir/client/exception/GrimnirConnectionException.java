package io.github.friendsincode.grimnir.client.exception;

import java.util.Objects;

/** Thrown when a network or connection failure occurs communicating with the backend. */
public final class GrimnirConnectionException extends GrimnirException {

  private static final long serialVersionUID = 1L;

  private final String url;

  /**
   * Creates a connection exception.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   */
  public GrimnirConnectionException(String message, String url) {
    super(message);
    this.url = Objects.requireNonNull(url, "url");
  }

  /**
   * Creates a connection exception with a cause.
   *
   * @param message description of the failure
   * @param url the URL that was being accessed
   * @param cause the underlying cause
   */
  public GrimnirConnectionException(String message, String url, Throwable cause) {
    super(message, cause);
    this.url = Objects.requireNonNull(url, "url");
  }

  /** Returns the URL that was being accessed when the failure occurred. */
  public String getUrl() {
    return url;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.CONNECTION;
  }
}
