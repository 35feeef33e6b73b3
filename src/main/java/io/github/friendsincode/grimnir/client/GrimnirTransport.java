package io.github.friendsincode.grimnir.client;

import java.time.Duration;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Transport interface for Grimnir Radio API HTTP communication.
 *
 * <p>Implementations perform one blocking round trip per call and return the response whatever
 * its status code. They throw {@link
 * io.github.friendsincode.grimnir.client.exception.GrimnirTimeoutException} when the timeout
 * elapses and {@link io.github.friendsincode.grimnir.client.exception.GrimnirConnectionException}
 * for any other network failure. A transport owns its connection pool and releases it on {@link
 * #close()}.
 */
public interface GrimnirTransport extends AutoCloseable {

  /**
   * Sends a request.
   *
   * <p>When {@code fileAttachment} is set the body is encoded as {@code multipart/form-data} with a
   * single part named {@code file}, and the transport sets the multipart {@code Content-Type}
   * itself. Otherwise a non-null {@code jsonBody} is serialized as JSON. With neither, no body is
   * sent. Callers never pass both.
   *
   * @param method the HTTP method
   * @param url fully-qualified URL including any query string
   * @param headers HTTP headers to include in the request
   * @param jsonBody JSON-serializable request body, or {@code null}
   * @param fileAttachment file to upload, or {@code null}
   * @param timeout bound on the whole call
   * @return the transport response
   */
  TransportResponse send(
      String method,
      String url,
      Map<String, String> headers,
      @Nullable Object jsonBody,
      @Nullable FileAttachment fileAttachment,
      Duration timeout);

  /** Releases the transport's connection resources. */
  @Override
  default void close() {}
}
