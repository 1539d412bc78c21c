package io.devhire.marketplace.security;

import java.util.Objects;
import java.util.UUID;

/**
 * The authenticated principal on whose behalf a workflow operation runs. Passed explicitly as the
 * first argument of every service operation.
 *
 * @param id the user id (JWT {@code sub})
 * @param role the single role the user acts under
 */
public record Actor(UUID id, MarketplaceRole role) {

  public Actor {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(role, "role");
  }

  public static Actor admin(UUID id) {
    return new Actor(id, MarketplaceRole.ADMIN);
  }

  public static Actor buyer(UUID id) {
    return new Actor(id, MarketplaceRole.BUYER);
  }

  public static Actor developer(UUID id) {
    return new Actor(id, MarketplaceRole.DEVELOPER);
  }

  public boolean isAdmin() {
    return role == MarketplaceRole.ADMIN;
  }

  public boolean isBuyer() {
    return role == MarketplaceRole.BUYER;
  }

  public boolean isDeveloper() {
    return role == MarketplaceRole.DEVELOPER;
  }
}
