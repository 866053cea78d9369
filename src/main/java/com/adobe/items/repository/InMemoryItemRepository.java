package com.adobe.items.repository;

import com.adobe.items.model.Item;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * {@link ItemRepository} backed by an {@link ArrayList} kept in process memory.
 *
 * <h2>Thread Safety:</h2>
 * <p>A {@link ReentrantReadWriteLock} guards the list. Reads run under the read
 * lock and return copies; every mutation (including the id allocation that
 * precedes an insert) runs under the write lock.</p>
 *
 * <p>Nothing is persisted: the contents are lost when the process exits.</p>
 *
 * @author Adobe AEM Engineering Assessment
 * @version 1.0.0
 */
public class InMemoryItemRepository implements ItemRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryItemRepository.class);

    private final List<Item> items = new ArrayList<>();
    private final IdAllocator idAllocator;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Lock readLock = lock.readLock();
    private final Lock writeLock = lock.writeLock();

    /**
     * Creates an empty repository.
     *
     * @param idAllocator the id allocation strategy
     */
    public InMemoryItemRepository(IdAllocator idAllocator) {
        this.idAllocator = idAllocator;
        logger.info("In-memory item repository created with {}", idAllocator.getClass().getSimpleName());
    }

    @Override
    public List<Item> findAll() {
        readLock.lock();
        try {
            return List.copyOf(items);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Optional<Item> findById(long id) {
        readLock.lock();
        try {
            int index = indexOf(id);
            return index >= 0 ? Optional.of(items.get(index)) : Optional.empty();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public long nextId() {
        readLock.lock();
        try {
            return idAllocator.peek(items);
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public Item insert(String name, String description) {
        String effectiveDescription = description == null || description.isEmpty()
            ? Item.DEFAULT_DESCRIPTION
            : description;

        writeLock.lock();
        try {
            Item item = new Item(idAllocator.allocate(items), name, effectiveDescription);
            items.add(item);
            logger.debug("Inserted {}", item);
            return item;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Item> update(long id, String name, String description) {
        writeLock.lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                return Optional.empty();
            }
            Item updated = items.get(index).merge(name, description);
            items.set(index, updated);
            logger.debug("Updated {}", updated);
            return Optional.of(updated);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public boolean deleteById(long id) {
        writeLock.lock();
        try {
            int index = indexOf(id);
            if (index < 0) {
                return false;
            }
            Item removed = items.remove(index);
            logger.debug("Removed {}", removed);
            return true;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public int count() {
        readLock.lock();
        try {
            return items.size();
        } finally {
            readLock.unlock();
        }
    }

    @Override
    public void clear() {
        writeLock.lock();
        try {
            items.clear();
            idAllocator.reset();
        } finally {
            writeLock.unlock();
        }
    }

    // Caller must hold a lock.
    private int indexOf(long id) {
        for (int i = 0; i < items.size(); i++) {
            if (items.get(i).id() == id) {
                return i;
            }
        }
        return -1;
    }
}
