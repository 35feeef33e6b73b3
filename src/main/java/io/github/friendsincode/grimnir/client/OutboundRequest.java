package io.github.friendsincode.grimnir.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Description of one API call, before credentials and encoding are applied.
 *
 * <p>A request carries at most one body: a JSON-serializable object or a file attachment, never
 * both. Query parameters keep their insertion order.
 *
 * @param method the HTTP method, upper-cased
 * @param path the API path below the version prefix, starting with {@code /}
 * @param queryParams query parameters, never null, unmodifiable
 * @param jsonBody a JSON-serializable body, or null
 * @param fileAttachment a file for a multipart upload, or null
 * @param contract how the successful response body is read
 */
public record OutboundRequest(
    String method,
    String path,
    Map<String, String> queryParams,
    @Nullable Object jsonBody,
    @Nullable FileAttachment fileAttachment,
    ContentContract contract) {

  /** Validates the request and copies the query parameters. */
  public OutboundRequest {
    method = Objects.requireNonNull(method, "method").toUpperCase(Locale.ROOT);
    Objects.requireNonNull(path, "path");
    if (!path.startsWith("/")) {
      throw new IllegalArgumentException("path must start with '/': " + path);
    }
    Objects.requireNonNull(queryParams, "queryParams");
    Map<String, String> copy = new LinkedHashMap<>();
    queryParams.forEach(
        (name, value) ->
            copy.put(
                Objects.requireNonNull(name, "query parameter name"),
                Objects.requireNonNull(value, "query parameter " + name)));
    queryParams = Collections.unmodifiableMap(copy);
    if (jsonBody != null && fileAttachment != null) {
      throw new IllegalArgumentException("a request cannot carry both a JSON body and a file");
    }
    Objects.requireNonNull(contract, "contract");
  }

  /** Creates a {@code GET} request without query parameters. */
  public static OutboundRequest get(String path) {
    return get(path, Map.of());
  }

  /** Creates a {@code GET} request. */
  public static OutboundRequest get(String path, Map<String, String> queryParams) {
    return new OutboundRequest("GET", path, queryParams, null, null, ContentContract.JSON);
  }

  /** Creates a {@code POST} request with an optional JSON body. */
  public static OutboundRequest post(String path, @Nullable Object jsonBody) {
    return new OutboundRequest("POST", path, Map.of(), jsonBody, null, ContentContract.JSON);
  }

  /** Creates a {@code DELETE} request. */
  public static OutboundRequest delete(String path) {
    return new OutboundRequest("DELETE", path, Map.of(), null, null, ContentContract.JSON);
  }

  /** Creates a multipart {@code POST} request carrying one file. */
  public static OutboundRequest upload(
      String path, Map<String, String> queryParams, FileAttachment fileAttachment) {
    return new OutboundRequest(
        "POST",
        path,
        queryParams,
        null,
        Objects.requireNonNull(fileAttachment, "fileAttachment"),
        ContentContract.JSON);
  }

  /** Returns a copy of this request read under a different content contract. */
  public OutboundRequest expecting(ContentContract newContract) {
    return new OutboundRequest(method, path, queryParams, jsonBody, fileAttachment, newContract);
  }
}
