package io.github.friendsincode.grimnir.client;

import java.util.Objects;

/**
 * Unclassified response of one dispatched call, tagged with the content contract its endpoint
 * declared.
 *
 * @param statusCode the HTTP status code
 * @param bodyText the response body, never null
 * @param contentDeclared how a successful body is to be read
 * @param endpointPath the API path that was called, for error reporting
 */
public record RawResponse(
    int statusCode, String bodyText, ContentContract contentDeclared, String endpointPath) {

  /** Validates non-null fields. */
  public RawResponse {
    Objects.requireNonNull(bodyText, "bodyText");
    Objects.requireNonNull(contentDeclared, "contentDeclared");
    Objects.requireNonNull(endpointPath, "endpointPath");
  }

  /** Returns whether the status code is 400 or above. */
  public boolean isFailure() {
    return statusCode >= 400;
  }
}
