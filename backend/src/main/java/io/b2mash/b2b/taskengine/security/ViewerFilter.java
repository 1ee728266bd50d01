package io.b2mash.b2b.taskengine.security;

import io.b2mash.b2b.taskengine.assignment.Viewer;
import io.b2mash.b2b.taskengine.assignment.ViewerRole;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Builds the {@link Viewer} for the request from the authenticated JWT and binds it to {@link
 * ViewerContext}. Requests without a verified token or without a recognised role continue
 * unbound; controllers that need a viewer then fail with {@link ViewerNotBoundException}.
 *
 * <p>Not a Spring bean: it is added to the security filter chain by {@link SecurityConfig} so that
 * it always runs after bearer token authentication.
 */
public class ViewerFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(ViewerFilter.class);

  private static final String MDC_ACTOR_ID = "actorId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Viewer viewer = resolveViewer();
    if (viewer == null) {
      filterChain.doFilter(request, response);
      return;
    }

    try {
      ViewerContext.bind(viewer);
      MDC.put(MDC_ACTOR_ID, viewer.actorId());
      filterChain.doFilter(request, response);
    } finally {
      ViewerContext.clear();
      MDC.remove(MDC_ACTOR_ID);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private Viewer resolveViewer() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return null;
    }

    Jwt jwt = jwtAuth.getToken();
    String actorId = ViewerJwtUtils.extractActorId(jwt);
    String role = ViewerJwtUtils.extractRole(jwt);
    if (actorId == null || role == null) {
      return null;
    }

    ViewerRole viewerRole = ViewerRole.fromClaim(role);
    if (viewerRole == null) {
      log.warn("Ignoring unrecognised role claim '{}' for actor {}", role, actorId);
      return null;
    }
    return new Viewer(actorId, viewerRole);
  }
}
