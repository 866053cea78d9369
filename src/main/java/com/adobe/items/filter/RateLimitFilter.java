package com.adobe.items.filter;

import com.adobe.items.config.RateLimitConfig;
import io.github.bucket4j.ConsumptionProbe;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Throttles calls to {@value #API_PREFIX} when rate limiting is switched on.
 *
 * <p>Admitted requests carry {@code X-Rate-Limit-Limit} and
 * {@code X-Rate-Limit-Remaining}. A client that has used up its bucket gets
 * 429 with {@code Retry-After} in whole seconds, and the rejection is counted
 * in {@code items.rate_limited}.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
@Order(1)
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String API_PREFIX = "/api/items";
    static final String LIMIT_HEADER = "X-Rate-Limit-Limit";
    static final String REMAINING_HEADER = "X-Rate-Limit-Remaining";

    private final RateLimitConfig rateLimitConfig;
    private final Counter rejected;

    public RateLimitFilter(RateLimitConfig rateLimitConfig, MeterRegistry meterRegistry) {
        this.rateLimitConfig = rateLimitConfig;
        this.rejected = Counter.builder("items.rate_limited")
            .description("Item API requests rejected by the rate limiter")
            .register(meterRegistry);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !rateLimitConfig.isEnabled() || !request.getRequestURI().startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String client = request.getRemoteAddr();
        ConsumptionProbe probe = rateLimitConfig.tryConsume(client);
        response.setHeader(LIMIT_HEADER, String.valueOf(rateLimitConfig.getRequestsPerMinute()));
        response.setHeader(REMAINING_HEADER, String.valueOf(probe.getRemainingTokens()));

        if (probe.isConsumed()) {
            filterChain.doFilter(request, response);
            return;
        }

        long retryAfter = Math.max(1, TimeUnit.NANOSECONDS.toSeconds(probe.getNanosToWaitForRefill()) + 1);
        rejected.increment();
        logger.warn("Throttled {} {} from {}, retry in {}s",
            request.getMethod(), request.getRequestURI(), client, retryAfter);

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfter));
        response.setContentType("text/plain");
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write("Too many item requests. Retry in " + retryAfter + " seconds.");
    }
}
