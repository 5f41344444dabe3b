package com.ryuqq.parley.adapter.inmemory.inbox;

import com.ryuqq.parley.core.message.Message;
import com.ryuqq.parley.core.spi.Inbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link Inbox} SPI.
 *
 * <p>One {@link ReentrantLock} guards an insertion-ordered buffer. Waiters block on a single
 * {@link Condition} that is signalled on every {@link #put(Message)} and on {@link #close()}, so a
 * waiter re-evaluates its own predicate exactly when the buffer changes.</p>
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Buffer:</strong> LinkedList&lt;Message&gt; - arrival order, matched items removed in place</li>
 *   <li><strong>Wake-up:</strong> Condition.signalAll - waiters with different predicates share one queue</li>
 *   <li><strong>Snapshot:</strong> immutable copy, the buffer is the only mutable store</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>put:</strong> O(1) plus waking the waiters</li>
 *   <li><strong>getBatch:</strong> O(N) scan per wake-up, N = buffered messages</li>
 *   <li><strong>peek:</strong> O(N)</li>
 * </ul>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public class InMemoryInbox implements Inbox {

    private static final Logger log = LoggerFactory.getLogger(InMemoryInbox.class);

    private final String owner;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final LinkedList<Message> buffer = new LinkedList<>();
    private boolean closed;

    /**
     * Creates an inbox.
     *
     * @param owner label used in log lines (usually the participant's formatted id)
     */
    public InMemoryInbox(String owner) {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner cannot be null or blank");
        }
        this.owner = owner;
    }

    @Override
    public void put(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Inbox of " + owner + " is closed");
            }
            buffer.addLast(message);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>The deadline is computed once; spurious wake-ups resume with the remaining time</li>
     *   <li>An interrupt restores the interrupt flag and surfaces as {@link IllegalStateException}</li>
     * </ul>
     */
    @Override
    public List<Message> getBatch(
        Predicate<Message> filter,
        Duration timeout,
        int minItems,
        int maxItems,
        Predicate<Message> releaseNow
    ) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        if (minItems < 1) {
            throw new IllegalArgumentException("minItems must be at least 1, but was: " + minItems);
        }
        if (maxItems < minItems) {
            throw new IllegalArgumentException("maxItems must be >= minItems, but was: " + maxItems);
        }
        if (releaseNow == null) {
            throw new IllegalArgumentException("releaseNow cannot be null");
        }

        long remainingNanos = timeout.toNanos();
        lock.lock();
        try {
            while (!closed && !ready(filter, minItems, releaseNow)) {
                if (remainingNanos <= 0L) {
                    break;
                }
                remainingNanos = changed.awaitNanos(remainingNanos);
            }
            List<Message> batch = drain(filter, maxItems);
            log.debug("Inbox {} released {} message(s), {} left buffered", owner, batch.size(), buffer.size());
            return batch;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting on inbox of " + owner, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Message> peek(Predicate<Message> filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        lock.lock();
        try {
            for (Message message : buffer) {
                if (filter.test(message)) {
                    return Optional.of(message);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Message> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(buffer));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (!closed) {
                closed = true;
                changed.signalAll();
                log.debug("Inbox {} closed with {} message(s) buffered", owner, buffer.size());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private boolean ready(Predicate<Message> filter, int minItems, Predicate<Message> releaseNow) {
        int matched = 0;
        for (Message message : buffer) {
            if (filter.test(message)) {
                if (releaseNow.test(message)) {
                    return true;
                }
                matched++;
                if (matched >= minItems) {
                    return true;
                }
            }
        }
        return false;
    }

    // caller holds lock
    private List<Message> drain(Predicate<Message> filter, int maxItems) {
        List<Message> batch = new ArrayList<>();
        Iterator<Message> it = buffer.iterator();
        while (it.hasNext() && batch.size() < maxItems) {
            Message message = it.next();
            if (filter.test(message)) {
                batch.add(message);
                it.remove();
            }
        }
        return batch;
    }

    @Override
    public String toString() {
        return "InMemoryInbox{owner=" + owner + ", size=" + size() + ", closed=" + isClosed() + "}";
    }
}
