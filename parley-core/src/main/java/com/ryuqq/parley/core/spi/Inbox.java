package com.ryuqq.parley.core.spi;

import com.ryuqq.parley.core.message.Message;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Per-participant event-driven message queue.
 *
 * <p>Waiters are suspended on a condition and woken whenever the queue changes. Implementations
 * must never poll with fixed-interval sleeps.</p>
 *
 * <h2>Retrieval Semantics</h2>
 * <ul>
 *   <li>Only matching items are removed; non-matching items keep their relative order</li>
 *   <li>A message put with no active waiter is returned to the next matching caller (no lost wakeups)</li>
 *   <li>On timeout the currently matching items are returned, possibly none</li>
 *   <li>Closing the queue wakes every waiter</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * List&lt;Message&gt; batch = inbox.getBatch(
 *     m -&gt; meetingId.equals(m.meetingId()),
 *     Duration.ofSeconds(5),
 *     100,
 *     100
 * );
 * </pre>
 *
 * @author Parley Team
 * @since 1.0.0
 */
public interface Inbox {

    /**
     * Appends a message and wakes all waiters.
     *
     * @param message the message to append
     * @throws IllegalArgumentException if message is null
     * @throws IllegalStateException if the inbox is closed
     */
    void put(Message message);

    /**
     * Waits for a batch of matching messages.
     *
     * <p>Returns as soon as {@code minItems} matching items are buffered, or a matching item
     * satisfies {@code releaseNow}, or the timeout elapses, or the inbox is closed.</p>
     *
     * @param filter selects the messages to return
     * @param timeout maximum time to wait ({@link Duration#ZERO} returns immediately)
     * @param minItems matching items that release the wait early (at least 1)
     * @param maxItems maximum number of items returned (at least minItems)
     * @param releaseNow matching items that end the wait immediately
     * @return removed matching messages in arrival order, possibly empty
     * @throws IllegalArgumentException if an argument is null or the bounds are invalid
     * @throws IllegalStateException if the waiting thread is interrupted
     */
    List<Message> getBatch(
        Predicate<Message> filter,
        Duration timeout,
        int minItems,
        int maxItems,
        Predicate<Message> releaseNow
    );

    /**
     * Waits for a batch of matching messages; human-originated messages end the wait immediately.
     *
     * @see #getBatch(Predicate, Duration, int, int, Predicate)
     */
    default List<Message> getBatch(Predicate<Message> filter, Duration timeout, int minItems, int maxItems) {
        return getBatch(filter, timeout, minItems, maxItems, Message::isFromHuman);
    }

    /**
     * Returns the first buffered message matching the predicate without removing it.
     *
     * @param filter predicate to test
     * @return first match, or empty
     */
    Optional<Message> peek(Predicate<Message> filter);

    /**
     * Read-only view of the buffered messages for legacy readers.
     *
     * @return immutable copy in arrival order
     */
    List<Message> snapshot();

    /**
     * Number of buffered messages.
     */
    int size();

    /**
     * Closes the inbox and wakes all waiters. Idempotent.
     */
    void close();

    boolean isClosed();
}
