package com.adobe.items.repository;

import com.adobe.items.model.Item;

import java.util.List;

/**
 * Strategy for choosing the id of the next item added to the store.
 *
 * <p>Implementations are not thread-safe on their own; the store calls them
 * while holding its write lock.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 * @see SequentialIdAllocator
 * @see MaxPlusOneIdAllocator
 */
public interface IdAllocator {

    /**
     * Returns the id the next inserted item would receive, without reserving it.
     *
     * @param current the items currently in the store, in insertion order
     * @return a positive id not used by any item in {@code current}
     */
    long peek(List<Item> current);

    /**
     * Returns the id for an item that is about to be inserted and records it
     * as issued.
     *
     * @param current the items currently in the store, in insertion order
     * @return a positive id not used by any item in {@code current}
     */
    default long allocate(List<Item> current) {
        return peek(current);
    }

    /**
     * Forgets every id issued so far. Called when the store is cleared.
     */
    default void reset() {
    }

    /**
     * Highest id among the given items, or 0 when there are none.
     */
    static long maxId(List<Item> items) {
        long max = 0;
        for (Item item : items) {
            max = Math.max(max, item.id());
        }
        return max;
    }
}
