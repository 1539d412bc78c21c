package io.devhire.marketplace.audit;

import static org.assertj.core.api.Assertions.assertThat;

import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.security.Roles;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

class AuditEventBuilderTest {

  @AfterEach
  void clearContext() {
    SecurityContextHolder.clearContext();
  }

  @Test
  void build_explicitActorWins() {
    var actor = Actor.developer(UUID.randomUUID());
    var entityId = UUID.randomUUID();

    var record =
        AuditEventBuilder.builder()
            .eventType("task.submitted")
            .entityType("task")
            .entityId(entityId)
            .actor(actor)
            .details(Map.of("filename", "a.zip"))
            .build();

    assertThat(record.actorId()).isEqualTo(actor.id());
    assertThat(record.actorRole()).isEqualTo("DEVELOPER");
    assertThat(record.entityId()).isEqualTo(entityId);
    assertThat(record.source()).isEqualTo("INTERNAL");
    assertThat(record.ipAddress()).isNull();
  }

  @Test
  void build_fallsBackToBearerTokenPrincipal() {
    var userId = UUID.randomUUID();
    var jwt =
        Jwt.withTokenValue("token")
            .header("alg", "RS256")
            .subject(userId.toString())
            .claim("role", Roles.BUYER)
            .issuedAt(Instant.now())
            .expiresAt(Instant.now().plusSeconds(60))
            .build();
    SecurityContextHolder.getContext()
        .setAuthentication(
            new JwtAuthenticationToken(
                jwt, List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_BUYER))));

    var record =
        AuditEventBuilder.builder()
            .eventType("security.access_denied")
            .entityType("security")
            .build();

    assertThat(record.actorId()).isEqualTo(userId);
    assertThat(record.actorRole()).isEqualTo("BUYER");
  }

  @Test
  void build_attributesUnauthenticatedEventsToSystem() {
    var record = AuditEventBuilder.builder().eventType("x").entityType("y").build();

    assertThat(record.actorId()).isNull();
    assertThat(record.actorRole()).isEqualTo("SYSTEM");
  }
}
