package com.adobe.items.repository;

/**
 * Selectable id allocation strategies, bound from {@code app.items.id-allocation}.
 */
public enum IdAllocationMode {

    /** Ids increase monotonically and are never reused. */
    SEQUENTIAL,

    /** Ids are {@code 1 + max(current ids)}; the highest id can be reused after deletion. */
    MAX_PLUS_ONE;

    /**
     * Creates a fresh allocator for this mode.
     *
     * @return a new allocator instance
     */
    public IdAllocator newAllocator() {
        return switch (this) {
            case SEQUENTIAL -> new SequentialIdAllocator();
            case MAX_PLUS_ONE -> new MaxPlusOneIdAllocator();
        };
    }
}
