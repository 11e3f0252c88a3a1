package com.ryuqq.statecheck.adapter.inmemory.store;

import com.ryuqq.statecheck.core.model.State;
import com.ryuqq.statecheck.core.spi.Exhausted;
import com.ryuqq.statecheck.core.spi.InternResult;
import com.ryuqq.statecheck.core.spi.Interned;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryStateStore test.
 *
 * <p>Covers deduplication by content, dense id assignment, bounded growth and
 * atomicity of concurrent interning.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
class InMemoryStateStoreTest {

    @Test
    void intern_NewState_AssignsDenseIds() {
        // Given
        InMemoryStateStore store = new InMemoryStateStore(10);

        // When
        InternResult first = store.intern(State.of("n", 0));
        InternResult second = store.intern(State.of("n", 1));

        // Then
        assertEquals(new Interned(0, true), first);
        assertEquals(new Interned(1, true), second);
        assertEquals(2, store.size());
        assertEquals(State.of("n", 1), store.get(1));
    }

    @Test
    void intern_StructurallyEqualState_ReturnsExistingId() {
        // Given
        InMemoryStateStore store = new InMemoryStateStore(10);
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 50);
        ab.put("b", 50);
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", 50L);
        ba.put("a", 50L);

        // When
        store.intern(State.of(ab));
        InternResult again = store.intern(State.of(ba));

        // Then
        assertEquals(new Interned(0, false), again);
        assertEquals(1, store.size());
    }

    @Test
    void intern_CapacityReached_ReturnsExhaustedWithoutInserting() {
        // Given
        InMemoryStateStore store = new InMemoryStateStore(2);
        store.intern(State.of("n", 0));
        store.intern(State.of("n", 1));

        // When
        InternResult result = store.intern(State.of("n", 2));

        // Then
        assertThat(result).isEqualTo(new Exhausted(2));
        assertThat(result.isExhausted()).isTrue();
        assertThat(store.size()).isEqualTo(2);
        assertThat(store.intern(State.of("n", 1))).isEqualTo(new Interned(1, false));
        assertThatThrownBy(() -> store.get(2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void intern_NullState_ThrowsException() {
        InMemoryStateStore store = new InMemoryStateStore(1);

        assertThatThrownBy(() -> store.intern(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    @Test
    void constructor_NonPositiveCapacity_ThrowsException() {
        assertThatThrownBy(() -> new InMemoryStateStore(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void intern_ConcurrentCallers_ExactlyOneObservesNew() throws Exception {
        // Given: 8 threads interning the same 500 states
        InMemoryStateStore store = new InMemoryStateStore(10_000);
        int threads = 8;
        int distinct = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        List<Callable<List<Interned>>> tasks = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            tasks.add(() -> {
                start.await();
                List<Interned> created = new ArrayList<>();
                for (int i = 0; i < distinct; i++) {
                    InternResult result = store.intern(State.of("n", i));
                    if (result instanceof Interned interned && interned.isNew()) {
                        created.add(interned);
                    }
                }
                return created;
            });
        }

        // When
        List<Future<List<Interned>>> futures = new ArrayList<>();
        for (Callable<List<Interned>> task : tasks) {
            futures.add(pool.submit(task));
        }
        start.countDown();
        Set<Integer> newIds = new HashSet<>();
        int newCount = 0;
        for (Future<List<Interned>> future : futures) {
            for (Interned interned : future.get(10, TimeUnit.SECONDS)) {
                newIds.add(interned.id());
                newCount++;
            }
        }
        pool.shutdown();

        // Then
        assertThat(newCount).isEqualTo(distinct);
        assertThat(newIds).hasSize(distinct);
        assertThat(store.size()).isEqualTo(distinct);
        assertThat(newIds).allMatch(id -> id >= 0 && id < distinct);
    }

    @Test
    void intern_ConcurrentCallersAtCapacity_NeverExceedsLimit() throws Exception {
        // Given
        InMemoryStateStore store = new InMemoryStateStore(100);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < 4; t++) {
            int offset = t * 1_000;
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 200; i++) {
                    store.intern(State.of("n", offset + i));
                }
            }));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // Then
        assertThat(store.size()).isEqualTo(100);
        for (int id = 0; id < 100; id++) {
            assertThat(store.get(id)).isNotNull();
        }
    }
}
