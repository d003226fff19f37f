package com.example.fok.config;

import com.example.fok.service.RateLimitDecision;
import com.example.fok.service.RateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Applies the shared fixed-window limit to the admin REST surface. Inbound bot events are limited per user by
 * the event router instead.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitingFilter extends OncePerRequestFilter {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final RateLimiter rateLimiter;
    private final Clock clock;

    public RateLimitingFilter(RateLimiter rateLimiter, Clock clock) {
        this.rateLimiter = rateLimiter;
        this.clock = clock;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith("/api/") || path.startsWith("/api/events");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        if (isAsyncDispatch(request) || "OPTIONS".equalsIgnoreCase(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        RateLimitDecision decision = rateLimiter.admit(resolveKey(request), clock.instant());
        if (decision.allowed()) {
            filterChain.doFilter(request, response);
            return;
        }

        writeRateLimitResponse(response, decision);
    }

    private void writeRateLimitResponse(HttpServletResponse response, RateLimitDecision decision) throws IOException {
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        long retryAfterSeconds = Math.max((decision.retryAfter().toMillis() + 999) / 1000, 1);
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.getWriter()
                .write("{\"error\":\"Request rate exceeded. Please retry later.\",\"code\":\"THROTTLED\",\"retryable\":true}");
    }

    private String resolveKey(HttpServletRequest request) {
        String actor = request.getHeader(ACTOR_HEADER);
        if (actor != null && !actor.isBlank()) {
            return "http:actor:" + actor.trim();
        }
        String forwardedFor = request.getHeader("X-Forwarded-For");
        String clientIp = forwardedFor != null && !forwardedFor.isBlank()
                ? forwardedFor.split(",")[0].trim()
                : request.getRemoteAddr();
        return "http:ip:" + clientIp;
    }
}
