package com.aim.auth.security;

import com.aim.auth.exception.AuthException;
import com.aim.auth.exception.StorageUnavailableException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * JwtAuthFilter intercepts every HTTP request exactly once.
 * - Extracts the credential: "Authorization: Bearer &lt;token&gt;" or "X-API-Key"
 * - Resolves it to a UserPrincipal through AccessControl
 * - Sets the principal into Spring Security's SecurityContext
 * - If no credential or an invalid one → request proceeds unauthenticated
 *   (SecurityConfig will block protected endpoints with 401)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String API_KEY_HEADER = "X-API-Key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final AccessControl accessControl;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         filterChain
    ) throws ServletException, IOException {

        final String authHeader = request.getHeader("Authorization");
        final String apiKey     = request.getHeader(API_KEY_HEADER);
        final String bearer     = authHeader != null && authHeader.startsWith(BEARER_PREFIX)
                ? authHeader.substring(BEARER_PREFIX.length()).trim()
                : null;

        // Skip if no credential present
        if (bearer == null && apiKey == null) {
            filterChain.doFilter(request, response);
            return;
        }

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            try {
                UserPrincipal principal = accessControl.authenticate(new RequestCredentials(bearer, apiKey));
                UsernamePasswordAuthenticationToken authToken =
                        new UsernamePasswordAuthenticationToken(principal, null, principal.authorities());
                authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authToken);
                log.debug("Authenticated user: {}", principal.getUsername());
            } catch (AuthException e) {
                // already logged with its specific kind by AccessControl
                log.debug("Request to {} continues unauthenticated", request.getRequestURI());
            } catch (StorageUnavailableException e) {
                log.error("Cannot authenticate request to {}: {}", request.getRequestURI(), e.getMessage());
                response.sendError(HttpServletResponse.SC_SERVICE_UNAVAILABLE, "Storage unavailable");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }
}
