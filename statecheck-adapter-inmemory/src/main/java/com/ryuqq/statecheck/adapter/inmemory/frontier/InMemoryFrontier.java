package com.ryuqq.statecheck.adapter.inmemory.frontier;

import com.ryuqq.statecheck.core.spi.Frontier;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lock-free FIFO implementation of {@link Frontier}.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Queue:</strong> ConcurrentLinkedQueue&lt;Integer&gt; - non-blocking FIFO of state ids</li>
 *   <li><strong>Size:</strong> AtomicInteger - O(1) size ({@code ConcurrentLinkedQueue.size()} is O(N))</li>
 * </ul>
 *
 * <p>With a single consumer, ids are polled in exactly the order they were offered,
 * which makes the sequential exploration breadth-first.</p>
 *
 * @author Statecheck Team
 * @since 1.0.0
 */
public class InMemoryFrontier implements Frontier {

    private final ConcurrentLinkedQueue<Integer> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger size = new AtomicInteger();

    @Override
    public void offer(int stateId) {
        if (stateId < 0) {
            throw new IllegalArgumentException("stateId cannot be negative (current: " + stateId + ")");
        }
        queue.offer(stateId);
        size.incrementAndGet();
    }

    @Override
    public int poll() {
        Integer stateId = queue.poll();
        if (stateId == null) {
            return EMPTY;
        }
        size.decrementAndGet();
        return stateId;
    }

    @Override
    public boolean isEmpty() {
        return queue.isEmpty();
    }

    @Override
    public int size() {
        return Math.max(0, size.get());
    }
}
