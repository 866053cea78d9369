package com.adobe.items.repository;

import com.adobe.items.model.Item;

import java.util.List;
import java.util.Optional;

/**
 * Ordered collection of {@link Item}s that owns id allocation.
 *
 * <p>Each operation is atomic with respect to every other operation on the
 * same repository: id allocation plus insertion, lookup plus update and lookup
 * plus removal never interleave with another mutation.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public interface ItemRepository {

    /**
     * Returns a snapshot of all items in insertion order.
     *
     * @return the items, possibly empty, never null
     */
    List<Item> findAll();

    /**
     * Looks up an item by id.
     *
     * @param id the item id
     * @return the item, or empty when no item has this id
     */
    Optional<Item> findById(long id);

    /**
     * Returns the id the next {@link #insert} would assign.
     *
     * @return the next id
     */
    long nextId();

    /**
     * Appends a new item with an allocated id.
     *
     * @param name        the item name
     * @param description the description; null or empty means {@link Item#DEFAULT_DESCRIPTION}
     * @return the stored item
     */
    Item insert(String name, String description);

    /**
     * Replaces the given fields of an existing item. A null field keeps the
     * stored value.
     *
     * @param id          the item id
     * @param name        new name, or null
     * @param description new description, or null
     * @return the updated item, or empty when no item has this id
     */
    Optional<Item> update(long id, String name, String description);

    /**
     * Removes the item with the given id.
     *
     * @param id the item id
     * @return true if an item was removed
     */
    boolean deleteById(long id);

    /**
     * @return the number of stored items
     */
    int count();

    /**
     * Removes every item and resets id allocation.
     */
    void clear();
}
