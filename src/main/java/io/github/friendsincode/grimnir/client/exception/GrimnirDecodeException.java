package io.github.friendsincode.grimnir.client.exception;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a successful response declared as JSON cannot be decoded, or when its envelope does
 * not have the expected shape.
 */
public final class GrimnirDecodeException extends GrimnirException {

  private static final long serialVersionUID = 1L;

  private final String rawBody;
  private final String endpointPath;

  /**
   * Creates a decode exception.
   *
   * @param message description of the failure
   * @param rawBody the response text that failed to decode
   * @param endpointPath the API path that was called
   */
  public GrimnirDecodeException(String message, String rawBody, String endpointPath) {
    super(message);
    this.rawBody = Objects.requireNonNull(rawBody, "rawBody");
    this.endpointPath = Objects.requireNonNull(endpointPath, "endpointPath");
  }

  /**
   * Creates a decode exception with a cause.
   *
   * @param message description of the failure
   * @param rawBody the response text that failed to decode
   * @param endpointPath the API path that was called
   * @param cause the parser failure, or {@code null}
   */
  public GrimnirDecodeException(
      String message, String rawBody, String endpointPath, @Nullable Throwable cause) {
    super(message, cause);
    this.rawBody = Objects.requireNonNull(rawBody, "rawBody");
    this.endpointPath = Objects.requireNonNull(endpointPath, "endpointPath");
  }

  /** Returns the response text that failed to decode. */
  public String getRawBody() {
    return rawBody;
  }

  /** Returns the API path that was called. */
  public String getEndpointPath() {
    return endpointPath;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.DECODE;
  }
}
