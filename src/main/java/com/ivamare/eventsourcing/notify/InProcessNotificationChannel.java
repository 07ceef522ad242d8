package com.ivamare.eventsourcing.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous in-process notification channel.
 */
public class InProcessNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(InProcessNotificationChannel.class);

    private final Map<String, List<NotificationListener>> listeners = new ConcurrentHashMap<>();

    @Override
    public void publish(String topic, Object payload) {
        List<NotificationListener> subscribed = listeners.get(topic);
        if (subscribed == null) {
            return;
        }
        for (NotificationListener listener : subscribed) {
            try {
                listener.onNotification(topic, payload);
            } catch (RuntimeException e) {
                log.warn("Notification listener failed on topic {}: {}", topic, e.getMessage(), e);
            }
        }
    }

    @Override
    public void subscribe(String topic, NotificationListener listener) {
        listeners.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(listener);
    }

    @Override
    public void unsubscribe(String topic, NotificationListener listener) {
        List<NotificationListener> subscribed = listeners.get(topic);
        if (subscribed != null) {
            subscribed.remove(listener);
        }
    }

    public int listenerCount(String topic) {
        List<NotificationListener> subscribed = listeners.get(topic);
        return subscribed == null ? 0 : subscribed.size();
    }
}
