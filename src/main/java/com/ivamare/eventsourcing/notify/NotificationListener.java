package com.ivamare.eventsourcing.notify;

/**
 * Passive observer of a notification topic.
 */
@FunctionalInterface
public interface NotificationListener {

    void onNotification(String topic, Object payload);
}
