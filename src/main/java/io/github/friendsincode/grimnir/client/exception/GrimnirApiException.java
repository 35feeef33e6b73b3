package io.github.friendsincode.grimnir.client.exception;

import java.util.Objects;

/**
 * Thrown when the backend answers a call with an HTTP status of 400 or above.
 *
 * <p>The {@code rawBody} is the response text exactly as received. It is never JSON-decoded, so
 * an HTML error page or a truncated JSON document is preserved for diagnosis.
 */
public final class GrimnirApiException extends GrimnirException {

  private static final long serialVersionUID = 1L;

  private final int statusCode;
  private final String rawBody;
  private final String endpointPath;

  /**
   * Creates an API exception.
   *
   * @param statusCode the HTTP status code
   * @param rawBody the unparsed response body, never null
   * @param endpointPath the API path that was called (e.g. {@code /stations})
   */
  public GrimnirApiException(int statusCode, String rawBody, String endpointPath) {
    super(
        "API error "
            + statusCode
            + " on "
            + Objects.requireNonNull(endpointPath, "endpointPath")
            + ": "
            + Objects.requireNonNull(rawBody, "rawBody"));
    this.statusCode = statusCode;
    this.rawBody = rawBody;
    this.endpointPath = endpointPath;
  }

  /** Returns the HTTP status code. */
  public int getStatusCode() {
    return statusCode;
  }

  /** Returns the response body as received. */
  public String getRawBody() {
    return rawBody;
  }

  /** Returns the API path that was called. */
  public String getEndpointPath() {
    return endpointPath;
  }

  @Override
  public ErrorKind getKind() {
    return ErrorKind.API;
  }
}
