package com.adobe.items.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

/**
 * Writes one {@code items.access} line per item API call once the response
 * status is known, including calls that ended in an error response.
 *
 * <pre>
 * operation=createItem itemId=4 method=POST path=/api/items status=201 duration=3ms
 * operation=getItem itemId=abc method=GET path=/api/items/abc status=404 duration=1ms
 * </pre>
 *
 * <p>{@code itemId} is the raw path id, or for a create the id taken from the
 * {@code Location} header; {@code -} when neither exists. 4xx and 5xx lines
 * are logged at WARN.</p>
 */
@Component
public class ItemAccessLogInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger("items.access");
    private static final String START_NANOS_ATTR = ItemAccessLogInterceptor.class.getName() + ".start";
    private static final String NONE = "-";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        request.setAttribute(START_NANOS_ATTR, System.nanoTime());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        Object start = request.getAttribute(START_NANOS_ATTR);
        long durationMs = start instanceof Long nanos ? (System.nanoTime() - nanos) / 1_000_000 : 0;
        int status = response.getStatus();

        String line = "operation={} itemId={} method={} path={} status={} duration={}ms";
        Object[] args = {operationOf(handler), itemIdOf(request, response),
            request.getMethod(), request.getRequestURI(), status, durationMs};

        if (status >= 400) {
            log.warn(line, args);
        } else {
            log.info(line, args);
        }
    }

    static String operationOf(Object handler) {
        return handler instanceof HandlerMethod method ? method.getMethod().getName() : NONE;
    }

    static String itemIdOf(HttpServletRequest request, HttpServletResponse response) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map && map.get("id") != null) {
            return map.get("id").toString();
        }
        String location = response.getHeader(HttpHeaders.LOCATION);
        if (location != null && location.lastIndexOf('/') >= 0) {
            return location.substring(location.lastIndexOf('/') + 1);
        }
        return NONE;
    }
}
