package io.github.friendsincode.grimnir.client.exception;

/** Category of a {@link GrimnirException}, for callers that prefer a switch over catch blocks. */
public enum ErrorKind {
  /** Login or token refresh rejected by the backend. */
  AUTH,
  /** Any call answered with an HTTP status of 400 or above. */
  API,
  /** A successful response that should have been JSON could not be parsed. */
  DECODE,
  /** The configured request timeout elapsed before a response arrived. */
  TIMEOUT,
  /** A lower-level transport failure (DNS, refused connection, reset, TLS). */
  CONNECTION
}
