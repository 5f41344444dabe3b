package com.ryuqq.parley.testkit.contract;

import com.ryuqq.parley.core.event.ParleyEvent;
import com.ryuqq.parley.core.spi.EventListener;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event listener that records every event it receives.
 *
 * @param <E> event type
 * @author Parley Team
 * @since 1.0.0
 */
public class RecordingListener<E extends ParleyEvent> implements EventListener<E> {

    private final List<E> events = new CopyOnWriteArrayList<>();

    @Override
    public void onEvent(E event) {
        events.add(event);
    }

    public List<E> events() {
        return List.copyOf(events);
    }

    public int count() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
