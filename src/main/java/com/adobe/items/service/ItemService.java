package com.adobe.items.service;

import com.adobe.items.exception.InvalidInputException;
import com.adobe.items.exception.ItemNotFoundException;
import com.adobe.items.model.CreateItemRequest;
import com.adobe.items.model.Item;
import com.adobe.items.model.UpdateItemRequest;
import com.adobe.items.repository.ItemRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Service layer for item operations.
 *
 * <h2>Responsibilities:</h2>
 * <ul>
 *   <li>Parsing path ids; an unparseable id is treated as an unknown id</li>
 *   <li>Validating create payloads</li>
 *   <li>Signalling missing items with {@link ItemNotFoundException}</li>
 *   <li>Recording Micrometer metrics per operation and outcome</li>
 * </ul>
 *
 * <h2>Metrics:</h2>
 * <ul>
 *   <li>{@code items.operations} counter, tags {@code operation} and {@code outcome}</li>
 *   <li>{@code items.stored} gauge, current store size</li>
 * </ul>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
@Service
public class ItemService {

    private static final Logger logger = LoggerFactory.getLogger(ItemService.class);

    public static final String NAME_REQUIRED_MESSAGE = "Name is required to create an item.";

    static final String OPERATIONS_METRIC = "items.operations";

    private final ItemRepository itemRepository;
    private final MeterRegistry meterRegistry;

    /**
     * @param itemRepository the item store
     * @param meterRegistry  the Micrometer registry for metrics
     */
    public ItemService(ItemRepository itemRepository, MeterRegistry meterRegistry) {
        this.itemRepository = itemRepository;
        this.meterRegistry = meterRegistry;

        Gauge.builder("items.stored", itemRepository, ItemRepository::count)
            .description("Number of items currently held in memory")
            .register(meterRegistry);
    }

    /**
     * Returns every item in insertion order.
     *
     * @return the items, possibly empty
     */
    public List<Item> listItems() {
        List<Item> items = itemRepository.findAll();
        record("list", "success");
        logger.debug("Listed {} items", items.size());
        return items;
    }

    /**
     * Fetches one item.
     *
     * @param rawId the id as received in the request path
     * @return the item
     * @throws ItemNotFoundException if the id does not parse or matches no item
     */
    public Item getItem(String rawId) {
        Item item = parseId(rawId)
            .flatMap(itemRepository::findById)
            .orElseThrow(() -> notFound("get", rawId));

        record("get", "success");
        logger.debug("Found item {}", item);
        return item;
    }

    /**
     * Creates an item.
     *
     * <p>{@code name} is required and must not be empty. A missing or empty
     * {@code description} is replaced with {@link Item#DEFAULT_DESCRIPTION}.</p>
     *
     * @param request the payload, null when the request had no body
     * @return the created item
     * @throws InvalidInputException if the name is missing or empty
     */
    public Item createItem(CreateItemRequest request) {
        if (request == null || request.name() == null || request.name().isEmpty()) {
            record("create", "invalid");
            throw new InvalidInputException(NAME_REQUIRED_MESSAGE);
        }

        Item item = itemRepository.insert(request.name(), request.description());
        record("create", "success");
        logger.debug("Created item {}", item);
        return item;
    }

    /**
     * Partially updates an item.
     *
     * <p>Fields that are missing, null or empty in the payload keep their
     * stored value, so an update can never blank out a name.</p>
     *
     * @param rawId   the id as received in the request path
     * @param request the payload, null when the request had no body
     * @return the updated item
     * @throws ItemNotFoundException if the id does not parse or matches no item
     */
    public Item updateItem(String rawId, UpdateItemRequest request) {
        Optional<Long> id = parseId(rawId);
        if (id.isEmpty()) {
            throw notFound("update", rawId);
        }

        String name = request != null ? request.name() : null;
        String description = request != null ? request.description() : null;

        Item item = itemRepository.update(id.get(), name, description)
            .orElseThrow(() -> notFound("update", rawId));

        record("update", "success");
        logger.debug("Updated item {}", item);
        return item;
    }

    /**
     * Deletes an item.
     *
     * @param rawId the id as received in the request path
     * @throws ItemNotFoundException if the id does not parse or matches no item
     */
    public void deleteItem(String rawId) {
        boolean removed = parseId(rawId)
            .map(itemRepository::deleteById)
            .orElse(false);

        if (!removed) {
            throw notFound("delete", rawId);
        }
        record("delete", "success");
    }

    /**
     * Parses a path id as a decimal long.
     *
     * @param rawId the raw path segment
     * @return the id, or empty when the value is not a number
     */
    static Optional<Long> parseId(String rawId) {
        if (rawId == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(rawId));
        } catch (NumberFormatException e) {
            logger.debug("Path id '{}' is not numeric, treating as unknown", rawId);
            return Optional.empty();
        }
    }

    private ItemNotFoundException notFound(String operation, String rawId) {
        record(operation, "not_found");
        return new ItemNotFoundException(rawId);
    }

    private void record(String operation, String outcome) {
        Counter.builder(OPERATIONS_METRIC)
            .description("Item operations by type and outcome")
            .tag("operation", operation)
            .tag("outcome", outcome)
            .register(meterRegistry)
            .increment();
    }
}
