package com.adobe.items.repository;

import com.adobe.items.model.Item;

import java.util.List;

/**
 * Monotonic id allocation: every id is one more than the highest id ever
 * issued (or present in the store), so ids are never reused after deletion.
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class SequentialIdAllocator implements IdAllocator {

    private long lastIssued;

    @Override
    public long peek(List<Item> current) {
        return Math.max(lastIssued, IdAllocator.maxId(current)) + 1;
    }

    @Override
    public long allocate(List<Item> current) {
        lastIssued = peek(current);
        return lastIssued;
    }

    @Override
    public void reset() {
        lastIssued = 0;
    }
}
