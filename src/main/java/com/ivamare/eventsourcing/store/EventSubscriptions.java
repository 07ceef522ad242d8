package com.ivamare.eventsourcing.store;

import java.time.Duration;

/**
 * Opens subscriptions with the configured batch size and poll interval.
 */
public class EventSubscriptions {

    private final EventStore eventStore;
    private final int batchSize;
    private final Duration pollInterval;

    public EventSubscriptions(EventStore eventStore, int batchSize, Duration pollInterval) {
        this.eventStore = eventStore;
        this.batchSize = batchSize;
        this.pollInterval = pollInterval;
    }

    /**
     * Subscribe to every event after {@code fromPosition}. 0 starts at the beginning.
     */
    public EventSubscription subscribe(long fromPosition) {
        return eventStore.subscribe(fromPosition, batchSize, pollInterval);
    }

    /**
     * Subscribe to events appended from now on.
     */
    public EventSubscription subscribeFromNow() {
        return subscribe(eventStore.getStreamPosition());
    }
}
