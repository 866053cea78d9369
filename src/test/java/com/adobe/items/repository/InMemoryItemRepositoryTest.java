package com.adobe.items.repository;

import com.adobe.items.model.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link InMemoryItemRepository}.
 *
 * Tests cover:
 * - Insertion order and lookups
 * - Default description
 * - Partial update merge rules
 * - Removal
 * - Both id allocation strategies
 * - Concurrent inserts
 */
@DisplayName("InMemoryItemRepository Tests")
class InMemoryItemRepositoryTest {

    private InMemoryItemRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryItemRepository(new SequentialIdAllocator());
        repository.insert("Item A", "Description for Item A");
        repository.insert("Item B", "Description for Item B");
        repository.insert("Item C", "Description for Item C");
    }

    @Nested
    @DisplayName("Reads")
    class Reads {

        @Test
        @DisplayName("findAll returns items in insertion order")
        void shouldListInInsertionOrder() {
            List<Item> items = repository.findAll();

            assertEquals(3, items.size());
            assertEquals(List.of(1L, 2L, 3L), items.stream().map(Item::id).toList());
            assertEquals("Item B", items.get(1).name());
        }

        @Test
        @DisplayName("findAll returns a snapshot")
        void shouldReturnSnapshot() {
            List<Item> snapshot = repository.findAll();
            repository.insert("Item D", null);

            assertEquals(3, snapshot.size());
            assertThrows(UnsupportedOperationException.class, () -> snapshot.add(new Item(9, "x", "y")));
        }

        @Test
        @DisplayName("findById returns the matching item")
        void shouldFindById() {
            Optional<Item> item = repository.findById(2);

            assertTrue(item.isPresent());
            assertEquals(new Item(2, "Item B", "Description for Item B"), item.get());
        }

        @Test
        @DisplayName("findById returns empty for unknown id")
        void shouldReturnEmptyForUnknownId() {
            assertTrue(repository.findById(42).isEmpty());
            assertTrue(repository.findById(0).isEmpty());
            assertTrue(repository.findById(-1).isEmpty());
        }
    }

    @Nested
    @DisplayName("Insert")
    class Insert {

        @Test
        @DisplayName("Missing description gets the default")
        void shouldApplyDefaultDescriptionForNull() {
            Item item = repository.insert("X", null);

            assertEquals(4, item.id());
            assertEquals(Item.DEFAULT_DESCRIPTION, item.description());
        }

        @Test
        @DisplayName("Empty description gets the default")
        void shouldApplyDefaultDescriptionForEmpty() {
            Item item = repository.insert("X", "");

            assertEquals("No description provided", item.description());
        }

        @Test
        @DisplayName("nextId matches the id the next insert receives")
        void shouldPeekNextId() {
            long peeked = repository.nextId();
            assertEquals(peeked, repository.nextId());

            Item item = repository.insert("X", "Y");

            assertEquals(peeked, item.id());
            assertEquals(peeked + 1, repository.nextId());
        }
    }

    @Nested
    @DisplayName("Update")
    class Update {

        @Test
        @DisplayName("Null fields keep stored values")
        void shouldKeepNullFields() {
            Item updated = repository.update(1, null, "D2").orElseThrow();

            assertEquals(new Item(1, "Item A", "D2"), updated);
            assertEquals(updated, repository.findById(1).orElseThrow());
        }

        @Test
        @DisplayName("Empty strings keep stored values")
        void shouldKeepEmptyFields() {
            Item updated = repository.update(1, "", "").orElseThrow();

            assertEquals(new Item(1, "Item A", "Description for Item A"), updated);
        }

        @Test
        @DisplayName("Empty name is ignored while the description still changes")
        void shouldApplyDescriptionAlongsideEmptyName() {
            Item updated = repository.update(2, "", "D2").orElseThrow();

            assertEquals(new Item(2, "Item B", "D2"), updated);
        }

        @Test
        @DisplayName("Update keeps the item's position")
        void shouldKeepPosition() {
            repository.update(2, "Renamed", null);

            assertEquals("Renamed", repository.findAll().get(1).name());
        }

        @Test
        @DisplayName("Unknown id returns empty")
        void shouldReturnEmptyForUnknownId() {
            assertTrue(repository.update(99, "X", "Y").isEmpty());
            assertEquals(3, repository.count());
        }
    }

    @Nested
    @DisplayName("Delete")
    class Delete {

        @Test
        @DisplayName("Removes exactly one item")
        void shouldRemoveOnce() {
            assertTrue(repository.deleteById(2));
            assertFalse(repository.deleteById(2));

            assertEquals(2, repository.count());
            assertEquals(List.of(1L, 3L), repository.findAll().stream().map(Item::id).toList());
        }

        @Test
        @DisplayName("clear empties the store and restarts ids")
        void shouldClear() {
            repository.clear();

            assertEquals(0, repository.count());
            assertEquals(1, repository.nextId());
            assertEquals(1, repository.insert("X", null).id());
        }
    }

    @Nested
    @DisplayName("Id allocation")
    class IdAllocation {

        @Test
        @DisplayName("SEQUENTIAL never reuses the deleted max id")
        void sequentialShouldNotReuseIds() {
            repository.deleteById(3);

            assertEquals(4, repository.insert("New", null).id());
        }

        @Test
        @DisplayName("SEQUENTIAL does not reuse ids after everything is deleted")
        void sequentialShouldNotReuseAfterEmptying() {
            repository.deleteById(1);
            repository.deleteById(2);
            repository.deleteById(3);

            assertEquals(4, repository.nextId());
        }

        @Test
        @DisplayName("MAX_PLUS_ONE reuses the deleted max id")
        void maxPlusOneShouldReuseDeletedMaxId() {
            InMemoryItemRepository maxPlusOne = new InMemoryItemRepository(new MaxPlusOneIdAllocator());
            maxPlusOne.insert("A", null);
            maxPlusOne.insert("B", null);
            maxPlusOne.insert("C", null);

            maxPlusOne.deleteById(3);

            assertEquals(3, maxPlusOne.nextId());
            assertEquals(3, maxPlusOne.insert("D", null).id());
        }

        @Test
        @DisplayName("MAX_PLUS_ONE starts at 1 on an empty store")
        void maxPlusOneShouldStartAtOne() {
            InMemoryItemRepository maxPlusOne = new InMemoryItemRepository(new MaxPlusOneIdAllocator());

            assertEquals(1, maxPlusOne.nextId());
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent inserts receive distinct ids")
        void shouldAllocateDistinctIdsConcurrently() throws Exception {
            int threads = 8;
            int insertsPerThread = 250;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<List<Long>>> futures = new ArrayList<>();

            try {
                for (int t = 0; t < threads; t++) {
                    futures.add(executor.submit(() -> {
                        start.await();
                        List<Long> ids = new ArrayList<>();
                        for (int i = 0; i < insertsPerThread; i++) {
                            ids.add(repository.insert("n", null).id());
                        }
                        return ids;
                    }));
                }
                start.countDown();

                Set<Long> allIds = new HashSet<>();
                for (Future<List<Long>> future : futures) {
                    allIds.addAll(future.get());
                }

                assertEquals(threads * insertsPerThread, allIds.size());
                assertEquals(3 + threads * insertsPerThread, repository.count());
            } finally {
                executor.shutdownNow();
            }
        }
    }
}
