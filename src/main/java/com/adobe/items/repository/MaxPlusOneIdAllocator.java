package com.adobe.items.repository;

import com.adobe.items.model.Item;

import java.util.List;

/**
 * Id allocation recomputed from the current contents: {@code 1 + max(id)},
 * or 1 for an empty store.
 *
 * <p>Deleting the item holding the highest id lets the next created item
 * receive that same id again. Kept for clients that depend on this behavior;
 * {@link SequentialIdAllocator} is the default.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class MaxPlusOneIdAllocator implements IdAllocator {

    @Override
    public long peek(List<Item> current) {
        return IdAllocator.maxId(current) + 1;
    }
}
