package com.geevly.api;

import com.geevly.eventsourcing.EventStore;
import com.geevly.eventsourcing.PayloadCodec;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the event log, newest first.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventStore eventStore;
    private final PayloadCodec codec;

    public EventController(EventStore eventStore, PayloadCodec codec) {
        this.eventStore = eventStore;
        this.codec = codec;
    }

    @GetMapping
    public List<EventView> query(@RequestParam String stream,
                                 @RequestParam(required = false) String type,
                                 @RequestParam(name = "aggregate_id", required = false) String aggregateId,
                                 @RequestParam(defaultValue = "100") int limit) {
        return eventStore.query(
                stream,
                Optional.ofNullable(type),
                Optional.ofNullable(aggregateId),
                Math.max(1, Math.min(limit, 1000)))
            .stream()
            .map(e -> EventView.of(e, codec))
            .toList();
    }
}
