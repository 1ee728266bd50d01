package io.b2mash.b2b.taskengine.assignment;

import io.b2mash.b2b.taskengine.security.Roles;

public enum ViewerRole {
  ADMIN(Roles.ADMIN),
  MANAGER(Roles.MANAGER),
  EMPLOYEE(Roles.EMPLOYEE);

  private final String claim;

  ViewerRole(String claim) {
    this.claim = claim;
  }

  /** Admins and managers see every assigned client regardless of mappings. */
  public boolean isPrivileged() {
    return this == ADMIN || this == MANAGER;
  }

  /** Maps a JWT role claim to a role, or null when the claim is not recognised. */
  public static ViewerRole fromClaim(String claim) {
    for (ViewerRole role : values()) {
      if (role.claim.equals(claim)) {
        return role;
      }
    }
    return null;
  }
}
