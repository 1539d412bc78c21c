package io.devhire.marketplace.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class MarketplaceJwtAuthenticationConverterTest {

  private final MarketplaceJwtAuthenticationConverter converter =
      new MarketplaceJwtAuthenticationConverter();

  @Test
  void convert_mapsRoleClaimToAuthority() {
    var token = converter.convert(jwt(UUID.randomUUID().toString(), "buyer"));

    assertThat(token.getAuthorities())
        .extracting(GrantedAuthority::getAuthority)
        .containsExactly(Roles.AUTHORITY_BUYER);
  }

  @Test
  void convert_unknownRoleGrantsNothing() {
    var token = converter.convert(jwt(UUID.randomUUID().toString(), "superuser"));

    assertThat(token.getAuthorities()).isEmpty();
  }

  @Test
  void extract_resolvesSubjectAndRole() {
    var userId = UUID.randomUUID();
    var jwt = jwt(userId.toString(), "DEVELOPER");

    assertThat(MarketplaceJwtClaims.extractUserId(jwt)).isEqualTo(userId);
    assertThat(MarketplaceJwtClaims.extractRole(jwt)).isEqualTo(MarketplaceRole.DEVELOPER);
    assertThat(MarketplaceJwtClaims.extractUserId(jwt("user_123", "buyer"))).isNull();
  }

  private static Jwt jwt(String subject, String role) {
    return Jwt.withTokenValue("token")
        .header("alg", "RS256")
        .subject(subject)
        .claim("role", role)
        .issuedAt(Instant.now())
        .expiresAt(Instant.now().plusSeconds(300))
        .build();
  }
}
