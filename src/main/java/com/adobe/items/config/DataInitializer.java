package com.adobe.items.config;

import com.adobe.items.model.Item;
import com.adobe.items.repository.ItemRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Seeds the item store at startup.
 *
 * <p>The store starts with exactly three items (ids 1, 2, 3). Disable with
 * {@code app.items.seed.enabled=false} to start with an empty store.</p>
 */
@Configuration
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    /**
     * Seed items, inserted in this order.
     */
    public static final List<Item> SEED_ITEMS = List.of(
        new Item(1, "Item A", "Description for Item A"),
        new Item(2, "Item B", "Description for Item B"),
        new Item(3, "Item C", "Description for Item C")
    );

    @Bean
    @ConditionalOnProperty(name = "app.items.seed.enabled", havingValue = "true", matchIfMissing = true)
    CommandLineRunner initSeedItems(ItemRepository itemRepository) {
        return args -> seed(itemRepository);
    }

    /**
     * Replaces the repository contents with the seed items.
     *
     * @param itemRepository the repository to reset
     */
    public static void seed(ItemRepository itemRepository) {
        itemRepository.clear();
        for (Item seed : SEED_ITEMS) {
            Item stored = itemRepository.insert(seed.name(), seed.description());
            if (stored.id() != seed.id()) {
                throw new IllegalStateException(
                    "Seed item '" + seed.name() + "' expected id " + seed.id() + " but got " + stored.id());
            }
        }
        log.info("Seeded item store with {} items", SEED_ITEMS.size());
    }
}
