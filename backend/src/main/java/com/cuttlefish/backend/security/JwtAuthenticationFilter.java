package com.cuttlefish.backend.security;

import com.cuttlefish.backend.model.Capability;
import com.cuttlefish.backend.service.AccessControlService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.AntPathMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the bearer token to an actor and exposes the actor's current capabilities as authorities.
 * Capabilities are read per request, so grants and revocations apply to tokens already issued.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String AUTHORITY_PREFIX = "CAP_";

    private final JwtTokenProvider jwtTokenProvider;
    private final AccessControlService accessControl;
    private final AntPathMatcher pathMatcher = new AntPathMatcher();
    private final List<String> publicPaths = List.of(
            "/actuator/health",
            "/actuator/health/**",
            "/actuator/info",
            "/v3/api-docs",
            "/v3/api-docs/**",
            "/swagger-ui.html",
            "/swagger-ui/**",
            "/api/auth/token",
            "/api/dev/token"
    );

    public static String authorityOf(Capability capability) {
        return AUTHORITY_PREFIX + capability.name();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String jwt = getJwtFromRequest(request);
        if (jwt != null && jwtTokenProvider.validateToken(jwt)) {
            String actorId = jwtTokenProvider.getActorFromToken(jwt);
            Set<Capability> capabilities = accessControl.capabilitiesOf(actorId);
            List<GrantedAuthority> authorities = capabilities.stream()
                    .map(capability -> new SimpleGrantedAuthority(authorityOf(capability)))
                    .collect(Collectors.toList());

            ActorPrincipal principal = ActorPrincipal.builder()
                    .actorId(actorId)
                    .capabilities(capabilities)
                    .build();
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, null, authorities);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
            MDC.put("actor", actorId);

            log.debug("Authenticated actor={} capabilities={}", actorId, capabilities);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        return publicPaths.stream().anyMatch(pattern -> pathMatcher.match(pattern, path));
    }

    private String getJwtFromRequest(HttpServletRequest request) {
        String bearerToken = request.getHeader("Authorization");
        if (bearerToken != null && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        return null;
    }
}
