package io.github.friendsincode.grimnir.client;

import com.google.gson.Gson;
import io.github.friendsincode.grimnir.client.exception.GrimnirConnectionException;
import io.github.friendsincode.grimnir.client.exception.GrimnirTimeoutException;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import javax.net.ssl.SSLContext;
import org.jspecify.annotations.Nullable;

/**
 * JDK {@link HttpClient}-based implementation of {@link GrimnirTransport}.
 *
 * <p>Uses {@link java.net.http.HttpClient} for HTTP communication and Gson for JSON
 * serialization. Each transport created through a public constructor owns a dedicated executor
 * backing the client's connection pool; {@link #close()} shuts it down.
 */
public final class HttpClientTransport implements GrimnirTransport {

  static final String MULTIPART_FIELD_NAME = "file";

  private static final String CRLF = "\r\n";

  private final Gson gson = new Gson();
  private final HttpClient client;
  private final @Nullable ExecutorService executor;

  /** Creates a transport with a default TLS-verifying {@link HttpClient}. */
  public HttpClientTransport() {
    this.executor = newExecutor();
    this.client = HttpClient.newBuilder().executor(executor).build();
  }

  /**
   * Creates a transport with a custom {@link SSLContext}, e.g. one trusting a private CA.
   *
   * @param sslContext the SSL context to use
   */
  public HttpClientTransport(SSLContext sslContext) {
    Objects.requireNonNull(sslContext, "sslContext");
    this.executor = newExecutor();
    this.client = HttpClient.newBuilder().executor(executor).sslContext(sslContext).build();
  }

  /**
   * Creates a transport with an injected {@link HttpClient}. Package-private for testing; the
   * caller keeps ownership of the client's resources.
   *
   * @param client the HTTP client to use
   */
  HttpClientTransport(HttpClient client) {
    this.client = Objects.requireNonNull(client, "client");
    this.executor = null;
  }

  @Override
  public TransportResponse send(
      String method,
      String url,
      Map<String, String> headers,
      @Nullable Object jsonBody,
      @Nullable FileAttachment fileAttachment,
      Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    HttpRequest.Builder requestBuilder =
        HttpRequest.newBuilder().uri(URI.create(url)).timeout(timeout);

    headers.forEach(requestBuilder::header);

    if (fileAttachment != null) {
      String boundary = newBoundary();
      requestBuilder.header("Content-Type", "multipart/form-data; boundary=" + boundary);
      byte[] multipart = encodeMultipart(fileAttachment, boundary);
      requestBuilder.method(method, HttpRequest.BodyPublishers.ofByteArray(multipart));
    } else if (jsonBody != null) {
      String json = gson.toJson(jsonBody);
      requestBuilder.method(
          method, HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
    } else {
      requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
    }

    HttpResponse<String> response;
    try {
      response =
          client.send(
              requestBuilder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (HttpTimeoutException e) {
      throw new GrimnirTimeoutException("HTTP request timed out after " + timeout, url, timeout, e);
    } catch (IOException e) {
      throw new GrimnirConnectionException("HTTP request failed", url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GrimnirConnectionException("HTTP request interrupted", url, e);
    }

    return new TransportResponse(
        response.statusCode(), response.body(), flattenHeaders(response.headers()));
  }

  /** Shuts down the executor owned by this transport. Safe to call more than once. */
  @Override
  public void close() {
    if (executor != null) {
      executor.shutdown();
    }
  }

  /**
   * Encodes a single-file {@code multipart/form-data} body.
   *
   * <p>Quotes, CR and LF in the file name are percent-encoded, as browsers do.
   *
   * @param attachment the file to encode
   * @param boundary the part boundary, without leading dashes
   * @return the encoded body
   */
  static byte[] encodeMultipart(FileAttachment attachment, String boundary) {
    String filename =
        attachment
            .filename()
            .replace("\"", "%22")
            .replace("\r", "%0D")
            .replace("\n", "%0A");
    String head =
        "--"
            + boundary
            + CRLF
            + "Content-Disposition: form-data; name=\""
            + MULTIPART_FIELD_NAME
            + "\"; filename=\""
            + filename
            + "\""
            + CRLF
            + "Content-Type: "
            + attachment.mimeType()
            + CRLF
            + CRLF;
    String tail = CRLF + "--" + boundary + "--" + CRLF;

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(head.getBytes(StandardCharsets.UTF_8));
    out.writeBytes(attachment.content());
    out.writeBytes(tail.getBytes(StandardCharsets.UTF_8));
    return out.toByteArray();
  }

  /**
   * Flattens {@link HttpHeaders} multi-value map to single-value map per RFC 9110 section 5.3.
   *
   * <p>Multiple values for the same header name are joined with {@code ", "}.
   *
   * @param httpHeaders the HTTP response headers
   * @return a flattened string-to-string header map
   */
  static Map<String, String> flattenHeaders(HttpHeaders httpHeaders) {
    Map<String, String> result = new LinkedHashMap<>();
    httpHeaders.map().forEach((name, values) -> result.put(name, String.join(", ", values)));
    return result;
  }

  private static String newBoundary() {
    return "GrimnirBoundary" + UUID.randomUUID().toString().replace("-", "");
  }

  private static ExecutorService newExecutor() {
    return Executors.newCachedThreadPool(
        runnable -> {
          Thread thread = new Thread(runnable, "grimnir-http");
          thread.setDaemon(true);
          return thread;
        });
  }
}
