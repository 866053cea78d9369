package com.adobe.items.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import io.github.bucket4j.Refill;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ConcurrentLruCache;

import java.time.Duration;

/**
 * Optional per-client throttling of the item endpoints, backed by Bucket4j.
 *
 * <p>Off unless {@code app.rate-limiting.enabled=true}. Clients are keyed by
 * the socket address of the connection; forwarding headers are not trusted.
 * At most {@code app.rate-limiting.max-clients} buckets are kept, the least
 * recently seen client is evicted first and starts over with a full bucket.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Configuration
public class RateLimitConfig {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitConfig.class);

    private final boolean enabled;
    private final int requestsPerMinute;
    private final ConcurrentLruCache<String, Bucket> buckets;

    public RateLimitConfig(
            @Value("${app.rate-limiting.enabled:false}") boolean enabled,
            @Value("${app.rate-limiting.requests-per-minute:100}") int requestsPerMinute,
            @Value("${app.rate-limiting.max-clients:10000}") int maxClients) {
        if (requestsPerMinute <= 0) {
            throw new IllegalStateException(
                "app.rate-limiting.requests-per-minute must be positive, got: " + requestsPerMinute);
        }
        this.enabled = enabled;
        this.requestsPerMinute = requestsPerMinute;
        this.buckets = new ConcurrentLruCache<>(maxClients, client -> newBucket());

        if (enabled) {
            logger.info("Item API rate limiting on: {} requests/minute per client, tracking up to {} clients",
                requestsPerMinute, maxClients);
        }
    }

    /**
     * Takes one token from the client's bucket.
     *
     * @param clientAddress remote address of the caller
     * @return the probe telling whether the request may proceed
     */
    public ConsumptionProbe tryConsume(String clientAddress) {
        return buckets.get(clientAddress).tryConsumeAndReturnRemaining(1);
    }

    int trackedClients() {
        return buckets.size();
    }

    private Bucket newBucket() {
        return Bucket.builder()
            .addLimit(Bandwidth.classic(requestsPerMinute,
                Refill.greedy(requestsPerMinute, Duration.ofMinutes(1))))
            .build();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getRequestsPerMinute() {
        return requestsPerMinute;
    }
}
