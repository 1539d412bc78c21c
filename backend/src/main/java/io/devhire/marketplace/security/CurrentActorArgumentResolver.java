package io.devhire.marketplace.security;

import io.devhire.marketplace.exception.ForbiddenException;
import java.util.UUID;
import org.springframework.core.MethodParameter;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentActor @CurrentActor} {@link Actor} parameters from the bearer token
 * authenticated by the resource server.
 */
@Component
public class CurrentActorArgumentResolver implements HandlerMethodArgumentResolver {

  @Override
  public boolean supportsParameter(MethodParameter parameter) {
    return parameter.hasParameterAnnotation(CurrentActor.class)
        && Actor.class.equals(parameter.getParameterType());
  }

  @Override
  public Actor resolveArgument(
      MethodParameter parameter,
      ModelAndViewContainer mavContainer,
      NativeWebRequest webRequest,
      WebDataBinderFactory binderFactory) {
    return currentActor();
  }

  /** Resolves the actor bound to the current security context. */
  public static Actor currentActor() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      throw new ForbiddenException("Unauthenticated", "No bearer token principal is bound");
    }
    UUID userId = MarketplaceJwtClaims.extractUserId(jwtAuth.getToken());
    MarketplaceRole role = MarketplaceJwtClaims.extractRole(jwtAuth.getToken());
    if (userId == null || role == null) {
      throw new ForbiddenException(
          "Invalid principal", "Token must carry a UUID subject and a marketplace role");
    }
    return new Actor(userId, role);
  }
}
