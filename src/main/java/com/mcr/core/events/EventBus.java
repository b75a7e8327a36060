package com.mcr.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for request handling events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-session subscribers keyed by session id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<McrEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    /** Subscribers that receive every event, including those without a session. */
    private final CopyOnWriteArrayList<Consumer<McrEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Deliver an event to its session's subscribers and to every global one.
     * A subscriber that throws is logged and skipped.
     */
    public void publish(McrEvent event) {
        log.debug("Publishing event: {} for session {}", event.eventType(), event.sessionId());

        if (event.sessionId() != null) {
            List<Consumer<McrEvent>> sessionSubs = sessionSubscribers.get(event.sessionId());
            if (sessionSubs != null) {
                for (Consumer<McrEvent> subscriber : sessionSubs) {
                    deliverSafely(subscriber, event);
                }
            }
        }
        for (Consumer<McrEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for one session.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String sessionId, Consumer<McrEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<McrEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to events from all sessions.
     *
     * @param consumer callback invoked for each event regardless of session
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<McrEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<McrEvent> subscriber, McrEvent event) {
        try {
            subscriber.accept(event);
        } catch (RuntimeException e) {
            log.warn("Subscriber threw exception processing event {}: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
