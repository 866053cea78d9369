package com.adobe.items.filter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a correlation id, exposed in the MDC as
 * {@value #CORRELATION_ID_MDC_KEY} and echoed in {@value #CORRELATION_ID_HEADER}.
 *
 * <p>A caller-supplied id is reused only if it is 1-64 characters of letters,
 * digits, {@code .}, {@code _} or {@code -}; anything else (line breaks in
 * particular) would end up verbatim in log lines, so a fresh 8-character id
 * is issued instead. The id is also quoted in 500 responses as the reference
 * to search for.</p>
 *
 * <pre>
 * 2024-01-15 10:30:00 [http-nio-3000-exec-1] [abc12345] INFO ItemController - POST /api/items - item 4 created
 * </pre>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
@Order(0)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String correlationId = correlationIdFor(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        MDC.put(CORRELATION_ID_MDC_KEY, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CORRELATION_ID_MDC_KEY);
        }
    }

    static String correlationIdFor(String incoming) {
        if (incoming != null && ACCEPTED_ID.matcher(incoming).matches()) {
            return incoming;
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
