package com.hashhunt.event;

import java.util.Collection;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded multi-producer, single-consumer event queue.
 *
 * Workers only see it as an {@link EventSink}; the coordinator is the single
 * reader. Unbounded so a publishing worker never blocks; the progress cadence
 * keeps the number of queued events small.
 */
public class EventChannel implements EventSink {

    private final BlockingQueue<SearchEvent> queue = new LinkedBlockingQueue<>();

    @Override
    public void publish(SearchEvent event) {
        queue.add(event);
    }

    /**
     * Waits up to the timeout for the next event.
     *
     * @return the event, or null on timeout
     */
    public SearchEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Moves every queued event into {@code target} without blocking.
     *
     * @return number of events moved
     */
    public int drainTo(Collection<? super SearchEvent> target) {
        return queue.drainTo(target);
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
