package com.comparo.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for comparison events.
 * <p>
 * Each request has a channel holding its subscribers and a bounded history of the events already
 * published for it. A new request subscriber first receives that history, then live events, so a
 * client that connects after the comparison started still sees it from the beginning. Events of one
 * request are delivered in publish order; global subscribers receive every event and no history.
 * A forgotten request stays forgotten: later events for it reach only the global subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Events kept per request for replay. */
    static final int MAX_HISTORY = 2000;

    /** Forgotten request ids remembered to keep their channels from coming back. */
    static final int FORGOTTEN_MEMORY = 1024;

    private final ConcurrentHashMap<String, RequestChannel> channels = new ConcurrentHashMap<>();

    private final Set<String> forgotten = Collections.newSetFromMap(Collections.synchronizedMap(
            new LinkedHashMap<String, Boolean>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                    return size() > FORGOTTEN_MEMORY;
                }
            }));

    private final CopyOnWriteArrayList<Consumer<ComparoEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the request's subscribers and to every global subscriber.
     */
    public void publish(ComparoEvent event) {
        log.trace("Publishing event: {} for request {}", event.eventType(), event.requestId());

        RequestChannel channel = openChannel(event.requestId());
        if (channel != null) {
            channel.publish(event);
        } else {
            log.debug("Dropping {} for forgotten request {}", event.eventType(), event.requestId());
        }

        for (Consumer<ComparoEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific request, starting with the events already published.
     *
     * @param requestId the request to subscribe to
     * @param consumer  callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String requestId, Consumer<ComparoEvent> consumer) {
        RequestChannel channel = openChannel(requestId);
        if (channel == null) {
            log.debug("Request {} was forgotten; subscription receives nothing", requestId);
            return () -> { };
        }
        int replayed = channel.subscribe(consumer);
        log.debug("Subscribed to request {} (replayed {} event(s))", requestId, replayed);
        return () -> channel.unsubscribe(consumer);
    }

    /**
     * Subscribe to events from all requests. No history is replayed.
     */
    public Subscription subscribeAll(Consumer<ComparoEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /** Events published so far for a request, oldest first. */
    public List<ComparoEvent> history(String requestId) {
        RequestChannel channel = channels.get(requestId);
        return channel == null ? List.of() : channel.history();
    }

    /**
     * Drops the request's history and subscribers.
     */
    public void forget(String requestId) {
        forgotten.add(requestId);
        if (channels.remove(requestId) != null) {
            log.debug("Dropped event channel for request {}", requestId);
        }
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private RequestChannel openChannel(String requestId) {
        return channels.compute(requestId, (id, existing) ->
                existing != null || forgotten.contains(id) ? existing : new RequestChannel(id));
    }

    private static void deliverSafely(Consumer<ComparoEvent> subscriber, ComparoEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }

    private static final class RequestChannel {
        private final String requestId;
        private final Deque<ComparoEvent> history = new ArrayDeque<>();
        private final List<Consumer<ComparoEvent>> subscribers = new ArrayList<>();

        RequestChannel(String requestId) {
            this.requestId = requestId;
        }

        synchronized void publish(ComparoEvent event) {
            if (history.size() == MAX_HISTORY) {
                history.removeFirst();
                if (log.isDebugEnabled()) {
                    log.debug("History of request {} is full, oldest event dropped", requestId);
                }
            }
            history.addLast(event);
            for (Consumer<ComparoEvent> subscriber : List.copyOf(subscribers)) {
                deliverSafely(subscriber, event);
            }
        }

        synchronized int subscribe(Consumer<ComparoEvent> consumer) {
            for (ComparoEvent event : history) {
                deliverSafely(consumer, event);
            }
            subscribers.add(consumer);
            return history.size();
        }

        synchronized void unsubscribe(Consumer<ComparoEvent> consumer) {
            subscribers.remove(consumer);
        }

        synchronized List<ComparoEvent> history() {
            return List.copyOf(history);
        }
    }
}
