package com.ivamare.eventsourcing.notify;

/**
 * Topic names published on the {@link NotificationChannel}.
 */
public final class NotificationTopics {

    /**
     * Catch-all topic receiving every dispatched domain event.
     */
    public static final String DOMAIN_EVENT = "domain.event";

    public static final String REPLAY_PROGRESS = "replay.progress";
    public static final String REPLAY_COMPLETED = "replay.completed";
    public static final String REPLAY_STOPPED = "replay.stopped";

    private static final String EVENT_TYPE_PREFIX = "event.";

    private NotificationTopics() {
    }

    /**
     * Topic for one event type, e.g. {@code event.PortalCreated}.
     */
    public static String forEventType(String eventType) {
        return EVENT_TYPE_PREFIX + eventType;
    }
}
