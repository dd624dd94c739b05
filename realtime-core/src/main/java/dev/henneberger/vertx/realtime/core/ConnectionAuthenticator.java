package dev.henneberger.vertx.realtime.core;

import io.vertx.core.Future;

/**
 * Verifies an access token presented during the handshake or a token refresh.
 * A failed future rejects the connection (or the refresh).
 */
@FunctionalInterface
public interface ConnectionAuthenticator {
  Future<CallerIdentity> authenticate(String token);
}
