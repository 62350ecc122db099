package com.demo.messenger.infrastructure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, closable frame queue feeding a single writer.
 *
 * Producers never block: {@link #offer(String)} reports {@link OfferResult#FULL}
 * instead, and the hub treats that as backpressure. Closing is idempotent and
 * wakes the writer; frames queued before the close are still handed out.
 */
public class OutboundQueue {

    public enum OfferResult {
        QUEUED, FULL, CLOSED
    }

    private final int capacity;
    private final ArrayDeque<String> frames;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private boolean closed;

    public OutboundQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.frames = new ArrayDeque<>(capacity);
    }

    public OfferResult offer(String frame) {
        lock.lock();
        try {
            if (closed) {
                return OfferResult.CLOSED;
            }
            if (frames.size() >= capacity) {
                return OfferResult.FULL;
            }
            frames.addLast(frame);
            notEmpty.signal();
            return OfferResult.QUEUED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to the timeout for the next frame.
     *
     * @return the frame, or {@code null} on timeout or once the queue is closed and drained
     */
    public String poll(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (frames.isEmpty()) {
                if (closed || remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
            return frames.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every frame queued at this instant, in enqueue order.
     */
    public List<String> drain() {
        lock.lock();
        try {
            if (frames.isEmpty()) {
                return Collections.emptyList();
            }
            List<String> drained = new ArrayList<>(frames);
            frames.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if this call closed the queue, {@code false} if it was already closed
     */
    public boolean close() {
        lock.lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            notEmpty.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Closed and nothing left for the writer. */
    public boolean isDrained() {
        lock.lock();
        try {
            return closed && frames.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return frames.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }
}
