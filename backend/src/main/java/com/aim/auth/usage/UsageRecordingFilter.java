package com.aim.auth.usage;

import com.aim.auth.security.UserPrincipal;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Times every request and hands authenticated ones to {@link UsageRecorder}.
 * Registered as a plain servlet filter, so it runs inside the Spring Security
 * chain and sees the principal set by JwtAuthFilter.
 */
@Component
@RequiredArgsConstructor
public class UsageRecordingFilter extends OncePerRequestFilter {

    private final UsageRecorder usageRecorder;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         filterChain
    ) throws ServletException, IOException {

        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
            if (authentication != null && authentication.getPrincipal() instanceof UserPrincipal) {
                UserPrincipal principal = (UserPrincipal) authentication.getPrincipal();
                long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                usageRecorder.record(principal.getUserId(), request.getRequestURI(),
                        response.getStatus(), durationMs);
            }
        }
    }
}
