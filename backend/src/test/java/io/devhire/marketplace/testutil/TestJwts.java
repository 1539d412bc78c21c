package io.devhire.marketplace.testutil;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;

import io.devhire.marketplace.security.Actor;
import java.util.List;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;

/** Bearer token post-processors carrying the same claims a real token would. */
public final class TestJwts {

  private TestJwts() {}

  public static JwtRequestPostProcessor jwtFor(Actor actor) {
    return jwt()
        .jwt(j -> j.subject(actor.id().toString()).claim("role", actor.role().claimValue()))
        .authorities(List.of(new SimpleGrantedAuthority(actor.role().authority())));
  }
}
