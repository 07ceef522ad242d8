package com.ivamare.eventsourcing.notify;

/**
 * Fire-and-forget publish/subscribe channel for passive observers.
 *
 * <p>Listener failures never reach the publisher.
 */
public interface NotificationChannel {

    void publish(String topic, Object payload);

    void subscribe(String topic, NotificationListener listener);

    void unsubscribe(String topic, NotificationListener listener);
}
