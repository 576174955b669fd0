package io.clusterprobe.aggregation;

import io.clusterprobe.models.Result;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, closable queue carrying results from workload monitors (and synthesized
 * dispatch failures) to the aggregator's ingestion loop.
 *
 * <p>Many producers, one consumer. Once closed, producers are refused and the consumer
 * drains what is left before {@link #take()} reports the end of the stream.
 */
public class ResultQueue {

    private final int capacity;
    private final Deque<Result> items = new ArrayDeque<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private boolean closed;

    public ResultQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Enqueue a result, waiting for space if the queue is full.
     *
     * @throws IllegalStateException if the queue has been closed
     */
    public void put(Result result) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed && items.size() >= capacity) {
                notFull.await();
            }
            if (closed) {
                throw new IllegalStateException("result queue is closed");
            }
            items.addLast(result);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Enqueue without waiting. Returns false if the queue is full or closed.
     */
    public boolean offer(Result result) {
        lock.lock();
        try {
            if (closed || items.size() >= capacity) {
                return false;
            }
            items.addLast(result);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Next result, waiting while the queue is empty.
     *
     * @return the next result, or {@code null} once the queue is closed and drained
     */
    public Result take() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                notEmpty.await();
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #take()} but gives up after the timeout, returning {@code null}.
     */
    public Result poll(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (items.isEmpty() && !closed) {
                if (nanos <= 0L) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return dequeue();
        } finally {
            lock.unlock();
        }
    }

    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
            notFull.signalAll();
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

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    private Result dequeue() {
        Result next = items.pollFirst();
        if (next != null) {
            notFull.signal();
        }
        return next;
    }
}
