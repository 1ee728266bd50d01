package io.b2mash.b2b.taskengine.security;

import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Reads the identity claims the engine trusts from a verified JWT.
 *
 * <p>Expected format: {@code { "sub": "<actor id>", "role": "admin|manager|employee" }}
 */
public final class ViewerJwtUtils {

  private static final String ROLE_CLAIM = "role";

  /** Extracts the actor id ({@code sub}). */
  public static String extractActorId(Jwt jwt) {
    return jwt.getSubject();
  }

  /** Extracts the role claim, or null when absent or not a string. */
  public static String extractRole(Jwt jwt) {
    Object value = jwt.getClaim(ROLE_CLAIM);
    if (value instanceof String str) {
      return str;
    }
    return null;
  }

  private ViewerJwtUtils() {}
}
