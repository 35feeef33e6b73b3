package io.github.friendsincode.grimnir.client.exception;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when a login or token refresh is rejected by the backend.
 *
 * <p>The {@code statusCode} may be {@code null} when the backend accepted the call but the
 * response did not carry a usable token.
 */
public final class GrimnirAuthException extends GrimnirException {

  private static final long serialVersionUID = 1L;

  private final String endpointPath;
  private final @Nullable Integer statusCode;
  private final String rawBody;

  /**
   * Creates an auth exception.
   *
   * @param message description of the failure
   * @param endpointPath the auth path that was called
   * @param statusCode the HTTP status code, or {@code null} if not applicable
   * @param rawBody the unparsed response body, never null
   */
  public GrimnirAuthException(
      String message, String endpointPath, @Nullable Integer statusCode, String rawBody) {
    super(message);
    this.endpointPath = Objects.requireNonNull(endpointPath, "endpointPath");
    this.statusCode = statusCode;
    this.rawBody = Objects.requireNonNull(rawBody, "rawBody");
  }

  /** Returns the auth path that was called. */
  public String getEndpointPath() {
    return endpointPath;
  }

  /**
   * Returns the HTTP status code, or {@code null} if the failure was not a rejected status.
   *
   * @return the status code, or {@code null}
   */
  public @Nullable Integer getStatusCode() {
    return statusCode;
  }

  /** Returns the response body as received. */
  public String getRawBody() {
    return rawBody;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.AUTH;
  }
}
