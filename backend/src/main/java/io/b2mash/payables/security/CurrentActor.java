package io.b2mash.payables.security;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;

/**
 * The user performing the current request, resolved from the security context. Falls back to a
 * system actor outside of an authenticated request (scheduled jobs, tests without a JWT).
 *
 * @param id JWT subject
 * @param name display name from the {@code name} claim, or the subject when absent
 * @param authenticated whether the actor came from an authenticated request
 */
public record CurrentActor(String id, String name, boolean authenticated) {

  public static final CurrentActor SYSTEM = new CurrentActor("system", "System", false);

  public static CurrentActor resolve() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null || !authentication.isAuthenticated()) {
      return SYSTEM;
    }
    if (authentication instanceof JwtAuthenticationToken jwtAuth) {
      String name = jwtAuth.getToken().getClaimAsString("name");
      return new CurrentActor(jwtAuth.getName(), name != null ? name : jwtAuth.getName(), true);
    }
    return new CurrentActor(authentication.getName(), authentication.getName(), true);
  }
}
