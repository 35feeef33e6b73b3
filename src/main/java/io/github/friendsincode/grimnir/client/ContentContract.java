package io.github.friendsincode.grimnir.client;

/**
 * How a successful response body is to be read.
 *
 * <p>The contract is chosen by the calling endpoint, never inferred from response headers.
 */
public enum ContentContract {
  /** The body is a JSON object; an empty body reads as an empty object. */
  JSON,
  /** The body is returned verbatim without any decoding attempt. */
  RAW_TEXT
}
