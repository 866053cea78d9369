package com.adobe.items.filter;

import com.adobe.items.config.RateLimitConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RateLimitFilter}.
 * Tests rate limiting behavior including allowed and blocked requests.
 */
@DisplayName("RateLimitFilter Unit Tests")
class RateLimitFilterTest {

    private SimpleMeterRegistry meterRegistry;
    private RateLimitFilter filter;
    private FilterChain filterChain;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        filter = new RateLimitFilter(new RateLimitConfig(true, 5, 100), meterRegistry);
        filterChain = mock(FilterChain.class);
    }

    private static MockHttpServletRequest itemRequest(String uri, String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", uri);
        request.setRemoteAddr(remoteAddr);
        return request;
    }

    private void exhaust(String remoteAddr) throws Exception {
        for (int i = 0; i < 5; i++) {
            filter.doFilter(itemRequest("/api/items", remoteAddr), new MockHttpServletResponse(), filterChain);
        }
    }

    @Test
    @DisplayName("Request under rate limit is allowed")
    void shouldAllowRequestUnderRateLimit() throws Exception {
        MockHttpServletRequest request = itemRequest("/api/items", "127.0.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, filterChain);

        assertEquals(200, response.getStatus());
        verify(filterChain).doFilter(request, response);
        assertEquals("4", response.getHeader("X-Rate-Limit-Remaining"));
        assertEquals("5", response.getHeader("X-Rate-Limit-Limit"));
    }

    @Test
    @DisplayName("Item paths with an id are rate limited")
    void shouldRateLimitItemPaths() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(itemRequest("/api/items/3", "127.0.0.1"), response, filterChain);

        assertNotNull(response.getHeader("X-Rate-Limit-Remaining"));
    }

    @Test
    @DisplayName("Non-API request is not rate limited")
    void shouldNotRateLimitNonApiRequests() throws Exception {
        MockHttpServletRequest request = itemRequest("/actuator/health", "127.0.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
        assertNull(response.getHeader("X-Rate-Limit-Remaining"));
    }

    @Test
    @DisplayName("Request exceeding rate limit returns 429 and is counted")
    void shouldReturn429WhenRateLimitExceeded() throws Exception {
        exhaust("192.168.1.100");
        MockHttpServletRequest request = itemRequest("/api/items", "192.168.1.100");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, filterChain);

        assertEquals(429, response.getStatus());
        assertTrue(Long.parseLong(response.getHeader("Retry-After")) >= 1);
        assertEquals("0", response.getHeader("X-Rate-Limit-Remaining"));
        assertTrue(response.getContentAsString().startsWith("Too many item requests."));
        verify(filterChain, never()).doFilter(request, response);
        assertEquals(1.0, meterRegistry.get("items.rate_limited").counter().count());
    }

    @Test
    @DisplayName("X-Forwarded-For cannot be used to get a fresh bucket")
    void shouldIgnoreForwardedForHeader() throws Exception {
        exhaust("10.0.0.1");
        MockHttpServletRequest request = itemRequest("/api/items", "10.0.0.1");
        request.addHeader("X-Forwarded-For", "1.2.3.4");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, filterChain);

        assertEquals(429, response.getStatus());
        verify(filterChain, never()).doFilter(request, response);
    }

    @Test
    @DisplayName("Each remote address has its own bucket")
    void shouldKeepBucketsPerAddress() throws Exception {
        exhaust("10.0.0.1");
        MockHttpServletRequest request = itemRequest("/api/items", "10.0.0.2");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, filterChain);

        assertEquals(200, response.getStatus());
        verify(filterChain).doFilter(request, response);
    }

    @Test
    @DisplayName("Disabled rate limiting passes every request through")
    void shouldPassThroughWhenDisabled() throws Exception {
        RateLimitFilter disabled = new RateLimitFilter(new RateLimitConfig(false, 5, 100), meterRegistry);
        MockHttpServletRequest request = itemRequest("/api/items", "127.0.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        disabled.doFilter(request, response, filterChain);

        verify(filterChain).doFilter(request, response);
        assertNull(response.getHeader("X-Rate-Limit-Remaining"));
    }
}
