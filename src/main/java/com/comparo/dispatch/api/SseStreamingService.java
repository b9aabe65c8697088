package com.comparo.dispatch.api;

import com.comparo.core.events.ComparoEvent;
import com.comparo.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances for SSE streaming.
 * <p>
 * Each emitter follows one comparison and is completed after the comparison's
 * {@code comparison.completed} event. Idle connections are kept open with comment heartbeats.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 10 minutes. */
    private static final long DEFAULT_TIMEOUT_MS = 10 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdownNow();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // onError / onCompletion remove the registration
                log.debug("Heartbeat skipped for request {}: {}", registration.requestId, e.getMessage());
            }
        }
    }

    /**
     * Creates an SSE emitter that streams events for the given comparison.
     */
    public SseEmitter createEmitter(String requestId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for request {}: {}", requestId, e.getMessage());
        }

        // events published before this call are replayed by the bus
        EventBus.Subscription subscription = eventBus.subscribe(requestId, event -> {
            sendEvent(emitter, event);
            if (event.isTerminalForRequest()) {
                emitter.complete();
            }
        });

        var registration = new EmitterRegistration(requestId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for request {}", requestId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for request {}: {}", requestId, ex.getMessage());
            cleanup(registration);
        });

        log.info("SSE emitter created for request {} (timeout={}ms)", requestId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, ComparoEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("requestId", event.requestId());
            if (event.targetId() != null) {
                data.put("targetId", event.targetId());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event()
                    .name(event.eventType())
                    .data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for request {}: {}",
                    event.eventType(), event.requestId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String requestId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
