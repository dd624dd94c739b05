package dev.henneberger.vertx.realtime.core;

import io.vertx.core.json.JsonObject;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The authenticated (or anonymous) caller behind a connection, as produced by a
 * {@link ConnectionAuthenticator}.
 */
public final class CallerIdentity {

  public static final String ANONYMOUS_ROLE = "anon";

  private final String callerId;
  private final String role;
  private final Map<String, Object> claims;

  public CallerIdentity(String callerId, String role, Map<String, Object> claims) {
    this.callerId = callerId == null || callerId.isBlank() ? null : callerId;
    this.role = Objects.requireNonNull(role, "role");
    this.claims = claims == null || claims.isEmpty()
      ? Collections.emptyMap()
      : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
  }

  public static CallerIdentity anonymous() {
    return new CallerIdentity(null, ANONYMOUS_ROLE, null);
  }

  public static CallerIdentity of(String callerId, String role) {
    return new CallerIdentity(callerId, role, null);
  }

  /**
   * @return the caller id, or {@code null} for anonymous callers
   */
  public String callerId() {
    return callerId;
  }

  public String role() {
    return role;
  }

  public Map<String, Object> claims() {
    return claims;
  }

  public boolean isAnonymous() {
    return callerId == null;
  }

  /**
   * Stable prefix for every RLS cache entry of this identity. Changes whenever role or claims
   * change, so a refreshed token never reuses verdicts computed for the old claims.
   */
  public String cacheKeyPrefix() {
    String id = callerId == null ? "~anon" : callerId;
    String claimsDigest = claims.isEmpty()
      ? "-"
      : ChangeEventParser.digest(new JsonObject(new TreeMap<>(claims)).encode()).substring(0, 16);
    return id + '|' + role + '|' + claimsDigest + '|';
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("caller_id", callerId)
      .put("role", role);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CallerIdentity)) {
      return false;
    }
    CallerIdentity other = (CallerIdentity) o;
    return Objects.equals(callerId, other.callerId)
      && role.equals(other.role)
      && claims.equals(other.claims);
  }

  @Override
  public int hashCode() {
    return Objects.hash(callerId, role, claims);
  }

  @Override
  public String toString() {
    return "CallerIdentity{callerId=" + callerId + ", role=" + role + '}';
  }
}
