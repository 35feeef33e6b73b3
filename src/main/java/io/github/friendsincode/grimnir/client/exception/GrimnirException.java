package io.github.friendsincode.grimnir.client.exception;

/**
 * Base exception for all Grimnir Radio API client errors.
 *
 * <p>This is an unchecked exception hierarchy. All client errors extend this sealed class and
 * report their category through {@link #getKind()}.
 */
public abstract sealed class GrimnirException extends RuntimeException
    permits GrimnirAuthException,
        GrimnirApiException,
        GrimnirDecodeException,
        GrimnirTimeoutException,
        GrimnirConnectionException {

  private static final long serialVersionUID = 1L;

  /** Creates an exception with the given message. */
  protected GrimnirException(String message) {
    super(message);
  }

  /** Creates an exception with the given message and cause. */
  protected GrimnirException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Returns the error category. */
  public abstract ErrorKind getKind();
}
