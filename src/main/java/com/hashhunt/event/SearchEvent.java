package com.hashhunt.event;

/**
 * Message sent from a worker to the coordinator.
 * Events of one worker arrive in emission order; events of different
 * workers are arbitrarily interleaved.
 */
public interface SearchEvent {

    /**
     * @return id of the emitting worker
     */
    int getWorkerId();
}
