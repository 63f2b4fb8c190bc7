package io.b2mash.payables.security;

/**
 * Centralized role constants used by authentication and {@code @PreAuthorize} checks.
 *
 * <p>Roles arrive in the {@code role} claim of the bearer JWT. Spring authorities are the {@code
 * ROLE_} prefixed versions.
 */
public final class Roles {

  // JWT "role" claim values
  public static final String SUPER_ADMIN = "super_admin";
  public static final String ADMIN = "admin";
  public static final String MEMBER = "member";

  // Spring Security granted authorities
  public static final String AUTHORITY_SUPER_ADMIN = "ROLE_SUPER_ADMIN";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_MEMBER = "ROLE_MEMBER";

  private Roles() {}
}
