package com.geevly.school;

import com.geevly.eventsourcing.Event;
import com.geevly.projection.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SchoolEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(SchoolEventHandler.class);

    private final SchoolRepository repository;

    public SchoolEventHandler(SchoolRepository repository) {
        this.repository = repository;
    }

    @Override
    public String stream() {
        return SchoolAggregate.STREAM;
    }

    @Override
    public void handle(Event event) {
        if (SchoolEventType.fromValue(event.type()).isEmpty()) {
            log.error("Unknown school event type={} aggregate={}", event.type(), event.aggregateId());
            return;
        }
        repository.upsertProjection(repository.load(event.aggregateId()));
    }
}
