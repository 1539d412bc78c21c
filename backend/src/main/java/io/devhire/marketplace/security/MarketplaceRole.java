package io.devhire.marketplace.security;

/** The role a principal acts under. A principal holds exactly one. */
public enum MarketplaceRole {
  ADMIN(Roles.ADMIN, Roles.AUTHORITY_ADMIN),
  BUYER(Roles.BUYER, Roles.AUTHORITY_BUYER),
  DEVELOPER(Roles.DEVELOPER, Roles.AUTHORITY_DEVELOPER);

  private final String claimValue;
  private final String authority;

  MarketplaceRole(String claimValue, String authority) {
    this.claimValue = claimValue;
    this.authority = authority;
  }

  public String claimValue() {
    return claimValue;
  }

  public String authority() {
    return authority;
  }

  /** Resolves a role from its JWT claim value, or null if the value is unknown. */
  public static MarketplaceRole fromClaim(String value) {
    if (value == null) {
      return null;
    }
    for (MarketplaceRole role : values()) {
      if (role.claimValue.equalsIgnoreCase(value)) {
        return role;
      }
    }
    return null;
  }
}
