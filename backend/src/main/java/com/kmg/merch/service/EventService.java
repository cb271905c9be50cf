package com.kmg.merch.service;

import com.kmg.merch.dto.EventMessage;
import com.kmg.merch.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Service
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final StatusStore statusStore;
    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public EventService(StatusStore statusStore) {
        this.statusStore = statusStore;
    }

    // New subscribers get the current snapshot first so they need not wait for the next item.
    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(ex -> emitters.remove(emitter));

        JobStatus snapshot = statusStore.snapshot();
        if (send(emitter, event("status", snapshot.runId(), "Current status", snapshot))) {
            emitters.add(emitter);
        }
        return emitter;
    }

    public int subscriberCount() {
        return emitters.size();
    }

    public void publish(String type, String runId, String message, Object payload) {
        if (emitters.isEmpty()) {
            return;
        }
        EventMessage event = event(type, runId, message, payload);
        for (SseEmitter emitter : emitters) {
            if (!send(emitter, event)) {
                emitters.remove(emitter);
            }
        }
    }

    private static EventMessage event(String type, String runId, String message, Object payload) {
        return new EventMessage(type, runId, message, OffsetDateTime.now().toString(), payload);
    }

    private static boolean send(SseEmitter emitter, EventMessage event) {
        try {
            emitter.send(SseEmitter.event().name(event.type()).data(event));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping SSE subscriber after {} send failure: {}", event.type(), e.getMessage());
            return false;
        }
    }
}
