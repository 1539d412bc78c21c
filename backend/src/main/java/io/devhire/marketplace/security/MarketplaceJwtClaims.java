package io.devhire.marketplace.security;

import java.util.UUID;
import org.springframework.security.oauth2.jwt.Jwt;

/**
 * Extracts marketplace identity claims from a bearer token.
 *
 * <p>Token format: {@code { "sub": "<user uuid>", "role": "buyer" }}
 */
public final class MarketplaceJwtClaims {

  private static final String ROLE_CLAIM = "role";

  /** Extracts the role claim, or null if absent or unknown. */
  public static MarketplaceRole extractRole(Jwt jwt) {
    Object value = jwt.getClaim(ROLE_CLAIM);
    if (value instanceof String str) {
      return MarketplaceRole.fromClaim(str);
    }
    return null;
  }

  /** Parses the subject as a user id, or null if it is not a UUID. */
  public static UUID extractUserId(Jwt jwt) {
    String subject = jwt.getSubject();
    if (subject == null) {
      return null;
    }
    try {
      return UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  private MarketplaceJwtClaims() {}
}
