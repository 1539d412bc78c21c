package io.devhire.marketplace.audit;

import io.devhire.marketplace.security.Actor;
import io.devhire.marketplace.security.MarketplaceJwtClaims;
import io.devhire.marketplace.security.MarketplaceRole;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor, source and IP address
 * from the current request context when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("proposal.accepted")
 *     .entityType("proposal")
 *     .entityId(proposal.getId())
 *     .actor(actor)
 *     .details(Map.of("project_id", proposal.getProjectId().toString()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final String SYSTEM_ROLE = "SYSTEM";

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID actorId;
  private String actorRole;
  private Map<String, Object> details;

  private boolean actorExplicitlySet;

  private AuditEventBuilder() {}

  /** Creates a new builder instance. */
  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actor(Actor actor) {
    this.actorId = actor.id();
    this.actorRole = actor.role().name();
    this.actorExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the {@link AuditEventRecord}. When no actor was given, the bearer token principal is
   * used if one is bound, otherwise the event is attributed to SYSTEM.
   */
  public AuditEventRecord build() {
    UUID resolvedActorId = actorId;
    String resolvedActorRole = actorRole;
    if (!actorExplicitlySet) {
      resolvedActorRole = SYSTEM_ROLE;
      if (SecurityContextHolder.getContext().getAuthentication()
          instanceof JwtAuthenticationToken jwtAuth) {
        resolvedActorId = MarketplaceJwtClaims.extractUserId(jwtAuth.getToken());
        MarketplaceRole role = MarketplaceJwtClaims.extractRole(jwtAuth.getToken());
        if (role != null) {
          resolvedActorRole = role.name();
        }
      }
    }

    HttpServletRequest request = resolveHttpRequest();
    String source = request != null ? "API" : "INTERNAL";
    String ipAddress = request != null ? request.getRemoteAddr() : null;

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedActorId,
        resolvedActorRole,
        source,
        ipAddress,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
