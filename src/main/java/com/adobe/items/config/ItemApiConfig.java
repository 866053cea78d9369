package com.adobe.items.config;

import com.adobe.items.repository.IdAllocationMode;
import com.adobe.items.repository.InMemoryItemRepository;
import com.adobe.items.repository.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Wires the item store and the MVC pieces around the item endpoints.
 *
 * <p>One {@link ItemRepository} instance is owned by the application context
 * and injected into the service layer; nothing holds it in a static field.</p>
 *
 * <h2>Id Allocation:</h2>
 * <ul>
 *   <li>{@code SEQUENTIAL} (default): monotonic, ids are never reused</li>
 *   <li>{@code MAX_PLUS_ONE}: {@code 1 + max(id)}, the highest id is reused
 *       after that item is deleted</li>
 * </ul>
 *
 * <p>{@link ItemAccessLogInterceptor} is applied to {@code /api/items}
 * only; docs and actuator calls are not access-logged.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Configuration
public class ItemApiConfig implements WebMvcConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(ItemApiConfig.class);

    private final ItemAccessLogInterceptor accessLogInterceptor;

    public ItemApiConfig(ItemAccessLogInterceptor accessLogInterceptor) {
        this.accessLogInterceptor = accessLogInterceptor;
    }

    @Bean
    public ItemRepository itemRepository(
            @Value("${app.items.id-allocation:SEQUENTIAL}") IdAllocationMode idAllocationMode) {
        logger.info("Item store id allocation mode: {}", idAllocationMode);
        return new InMemoryItemRepository(idAllocationMode.newAllocator());
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(accessLogInterceptor)
                .addPathPatterns("/api/items", "/api/items/**");
    }
}
