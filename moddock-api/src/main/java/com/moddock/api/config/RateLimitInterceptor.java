package com.moddock.api.config;

import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Enforces per-client rate limits; answers 429 when a bucket is empty.
 * Clients are keyed by network address only. Credentials are not verified
 * at this point, so they cannot identify a client.
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitConfig rateLimitConfig;
    private final boolean trustForwardedFor;

    public RateLimitInterceptor(
            RateLimitConfig rateLimitConfig,
            @Value("${moddock.rate-limit.trust-forwarded-for:false}") boolean trustForwardedFor) {
        this.rateLimitConfig = rateLimitConfig;
        this.trustForwardedFor = trustForwardedFor;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response,
                             Object handler) throws Exception {

        String clientId = resolveClientId(request);
        Bucket bucket = selectBucket(request, clientId);

        ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(1);

        if (probe.isConsumed()) {
            response.addHeader("X-Rate-Limit-Remaining",
                String.valueOf(probe.getRemainingTokens()));
            return true;
        }

        long waitForRefill = probe.getNanosToWaitForRefill() / 1_000_000_000;
        log.debug("Rate limit exceeded for {} on {} {}", clientId, request.getMethod(), request.getRequestURI());
        response.addHeader("X-Rate-Limit-Retry-After-Seconds", String.valueOf(waitForRefill));
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"RATE_LIMITED\",\"message\":\"Rate limit exceeded. Retry after "
                + waitForRefill + " seconds.\"}");
        return false;
    }

    private String resolveClientId(HttpServletRequest request) {
        // Only honoured behind a proxy that overwrites the header.
        if (trustForwardedFor) {
            String forwarded = request.getHeader("X-Forwarded-For");
            if (forwarded != null && !forwarded.isBlank()) {
                return forwarded.split(",")[0].trim();
            }
        }
        return request.getRemoteAddr();
    }

    private Bucket selectBucket(HttpServletRequest request, String clientId) {
        if ("DELETE".equals(request.getMethod()) || request.getRequestURI().startsWith("/v2/pat")) {
            return rateLimitConfig.resolveStrictBucket(clientId);
        }
        return rateLimitConfig.resolveBucket(clientId);
    }
}
