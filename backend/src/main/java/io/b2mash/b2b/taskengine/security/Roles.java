package io.b2mash.b2b.taskengine.security;

/**
 * Centralized role constants used across authentication and authorization.
 *
 * <p>Roles come from the verified JWT {@code role} claim. Spring authorities are the {@code ROLE_}
 * prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // JWT "role" claim values
  public static final String ADMIN = "admin";
  public static final String MANAGER = "manager";
  public static final String EMPLOYEE = "employee";

  // Spring Security granted authorities
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_MANAGER = "ROLE_MANAGER";
  public static final String AUTHORITY_EMPLOYEE = "ROLE_EMPLOYEE";

  private Roles() {}
}
