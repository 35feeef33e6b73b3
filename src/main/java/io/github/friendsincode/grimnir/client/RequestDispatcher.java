package io.github.friendsincode.grimnir.client;

import io.github.friendsincode.grimnir.client.auth.CredentialManager;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Turns an {@link OutboundRequest} into one transport call.
 *
 * <p>Builds the absolute target from the client configuration, merges the credential headers,
 * drops the JSON content type for file uploads and applies the configured timeout. The response is
 * returned unclassified; {@link ResponseTranslator} decides success or failure. Nothing is retried.
 */
public final class RequestDispatcher {

  static final String CONTENT_TYPE_HEADER = "Content-Type";

  private final ClientConfig config;
  private final GrimnirTransport transport;
  private final CredentialManager credentialManager;

  /**
   * Creates a dispatcher.
   *
   * @param config the client configuration
   * @param transport the transport performing HTTP I/O
   * @param credentialManager the source of authentication headers
   */
  public RequestDispatcher(
      ClientConfig config, GrimnirTransport transport, CredentialManager credentialManager) {
    this.config = Objects.requireNonNull(config, "config");
    this.transport = Objects.requireNonNull(transport, "transport");
    this.credentialManager = Objects.requireNonNull(credentialManager, "credentialManager");
  }

  /**
   * Executes a request with the active credential's headers.
   *
   * @param request the request to send
   * @return the raw response, whatever its status code
   */
  public RawResponse execute(OutboundRequest request) {
    return execute(request, credentialManager.buildHeaders());
  }

  /**
   * Executes a request with an explicit header set, e.g. the unauthenticated login call.
   *
   * @param request the request to send
   * @param headers the headers to start from
   * @return the raw response, whatever its status code
   */
  RawResponse execute(OutboundRequest request, Map<String, String> headers) {
    Objects.requireNonNull(request, "request");
    Map<String, String> merged = new LinkedHashMap<>(headers);
    if (request.fileAttachment() != null) {
      merged.keySet().removeIf(CONTENT_TYPE_HEADER::equalsIgnoreCase);
    }

    TransportResponse response =
        transport.send(
            request.method(),
            buildUrl(request),
            merged,
            request.jsonBody(),
            request.fileAttachment(),
            config.timeout());

    return new RawResponse(
        response.statusCode(), response.body(), request.contract(), request.path());
  }

  String buildUrl(OutboundRequest request) {
    String target = config.resolve(request.path());
    if (request.queryParams().isEmpty()) {
      return target;
    }
    return target + "?" + encodeQuery(request.queryParams());
  }

  static String encodeQuery(Map<String, String> queryParams) {
    StringJoiner joiner = new StringJoiner("&");
    queryParams.forEach((name, value) -> joiner.add(encode(name) + "=" + encode(value)));
    return joiner.toString();
  }

  /** URL-encodes a query component or path segment, spaces as {@code %20}. */
  static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
