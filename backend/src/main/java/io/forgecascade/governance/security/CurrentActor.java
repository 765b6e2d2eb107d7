package io.forgecascade.governance.security;

import io.forgecascade.governance.exception.ForbiddenException;
import java.util.Optional;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * Resolves the acting member from the current security context. The token subject is the member's
 * UUID.
 */
public final class CurrentActor {

  private CurrentActor() {}

  /** Returns the actor ID if the request carries a JWT whose subject is a UUID. */
  public static Optional<UUID> actorId() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return Optional.empty();
    }
    String subject = jwtAuth.getToken().getSubject();
    if (subject == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(subject));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  public static UUID requireActorId() {
    return actorId()
        .orElseThrow(
            () ->
                new ForbiddenException(
                    "Unknown actor", "Token subject is not a valid member identifier"));
  }

  /** ADMIN and SYSTEM may act on proposals they did not author. */
  public static boolean isAdmin() {
    return hasAuthority(Roles.AUTHORITY_ADMIN) || hasAuthority(Roles.AUTHORITY_SYSTEM);
  }

  public static boolean hasAuthority(String authority) {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null) {
      return false;
    }
    for (GrantedAuthority granted : authentication.getAuthorities()) {
      if (authority.equals(granted.getAuthority())) {
        return true;
      }
    }
    return false;
  }
}
