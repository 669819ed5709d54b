package com.hashhunt.event;

/**
 * Write end of the worker → coordinator channel.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Delivers the event. Never drops it.
     */
    void publish(SearchEvent event);
}
