package com.geevly.projection;

import com.geevly.config.GeevlyProperties;
import com.geevly.eventsourcing.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands stored events to the event handler of their stream, on the caller's thread or on the
 * projection executor. A failed refresh is logged and dropped: the write it follows has already
 * been committed, and a later event or a rebuild brings the projection back in line.
 */
@Service
public class ProjectionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ProjectionDispatcher.class);

    private final Map<String, EventHandler> handlers = new LinkedHashMap<>();
    private final TaskExecutor executor;
    private final RefreshMode defaultMode;

    public ProjectionDispatcher(List<EventHandler> handlers,
                                @Qualifier("projectionExecutor") TaskExecutor executor,
                                GeevlyProperties properties) {
        for (EventHandler handler : handlers) {
            EventHandler previous = this.handlers.putIfAbsent(handler.stream(), handler);
            if (previous != null) {
                throw new IllegalStateException("two event handlers for stream " + handler.stream());
            }
        }
        this.executor = executor;
        this.defaultMode = properties.projections().mode();
    }

    public void publish(String stream, List<Event> events) {
        publish(stream, events, defaultMode);
    }

    public void publish(String stream, List<Event> events, RefreshMode mode) {
        if (events.isEmpty()) {
            return;
        }
        if (mode == RefreshMode.SYNC) {
            events.forEach(event -> dispatch(stream, event));
            return;
        }
        try {
            executor.execute(() -> events.forEach(event -> dispatch(stream, event)));
        } catch (RejectedExecutionException ex) {
            log.warn("Projection refresh rejected for stream={} aggregate={}: {}",
                stream, events.get(0).aggregateId(), ex.getMessage());
        }
    }

    private void dispatch(String stream, Event event) {
        EventHandler handler = handlers.get(stream);
        if (handler == null) {
            log.error("No event handler for stream={} type={}", stream, event.type());
            return;
        }
        try {
            handler.handle(event);
        } catch (Exception ex) {
            log.warn("Projection refresh failed for stream={} aggregate={} version={}: {}",
                stream, event.aggregateId(), event.version(), ex.getMessage());
        }
    }
}
