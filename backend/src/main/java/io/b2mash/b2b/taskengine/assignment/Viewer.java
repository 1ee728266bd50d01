package io.b2mash.b2b.taskengine.assignment;

import java.util.Objects;

/**
 * The actor on whose behalf an operation runs. Built by the authentication boundary from a verified
 * token; never deserialized from caller-controlled input.
 */
public record Viewer(String actorId, ViewerRole role) {

  public Viewer {
    Objects.requireNonNull(actorId, "actorId");
    Objects.requireNonNull(role, "role");
  }

  public boolean isPrivileged() {
    return role.isPrivileged();
  }
}
