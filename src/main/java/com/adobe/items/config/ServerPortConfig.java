package com.adobe.items.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.server.ConfigurableWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Binds the HTTP port from the {@code PORT} environment variable.
 *
 * <p>When {@code PORT} is set it overrides {@code server.port}; this customizer
 * runs after Spring Boot's own {@code server.*} customizer for that reason.
 * An absent or blank {@code PORT} leaves {@code server.port} alone, which
 * application.yml sets to 3000 and tests may set to 0.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Component
public class ServerPortConfig implements WebServerFactoryCustomizer<ConfigurableWebServerFactory>, Ordered {

    private static final Logger logger = LoggerFactory.getLogger(ServerPortConfig.class);

    private final String portValue;

    public ServerPortConfig(@Value("${PORT:}") String portValue) {
        this.portValue = portValue;
    }

    @Override
    public void customize(ConfigurableWebServerFactory factory) {
        resolvePort(portValue).ifPresent(port -> {
            logger.info("Server will listen on port {} from PORT", port);
            factory.setPort(port);
        });
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE;
    }

    /**
     * Resolves the port to listen on.
     *
     * @param value raw value of {@code PORT}, may be null
     * @return the parsed port, or empty when the value is null or blank
     * @throws IllegalStateException if the value is not a port number
     */
    public static OptionalInt resolvePort(String value) {
        if (value == null || value.isBlank()) {
            return OptionalInt.empty();
        }
        int port;
        try {
            port = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("PORT must be an integer, got: '" + value + "'", e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("PORT must be between 0 and 65535, got: " + port);
        }
        return OptionalInt.of(port);
    }
}
