package io.devhire.marketplace.security;

/**
 * Centralized role constants used across authentication, authorization, and access control.
 *
 * <p>Marketplace roles come from the JWT {@code role} claim. Spring authorities are the {@code
 * ROLE_} prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // JWT "role" claim values
  public static final String ADMIN = "admin";
  public static final String BUYER = "buyer";
  public static final String DEVELOPER = "developer";

  // Spring Security granted authorities
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";
  public static final String AUTHORITY_BUYER = "ROLE_BUYER";
  public static final String AUTHORITY_DEVELOPER = "ROLE_DEVELOPER";

  private Roles() {}
}
