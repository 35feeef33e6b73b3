package io.github.friendsincode.grimnir.client.auth;

/**
 * Sealed credential type for Grimnir Radio API authentication.
 *
 * <p>Exactly two variants exist: a static {@link ApiKeyAuth} and a session {@link
 * BearerTokenAuth}. A credential is never mutated; logging in or refreshing replaces it with a new
 * value. The {@link CredentialManager} dispatches on the concrete type using {@code instanceof}
 * pattern matching.
 */
public sealed interface Credentials permits ApiKeyAuth, BearerTokenAuth {}
