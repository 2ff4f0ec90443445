package com.geevly.user;

import com.geevly.eventsourcing.Event;
import com.geevly.projection.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class UserEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(UserEventHandler.class);

    private final UserRepository repository;

    public UserEventHandler(UserRepository repository) {
        this.repository = repository;
    }

    @Override
    public String stream() {
        return UserAggregate.STREAM;
    }

    @Override
    public void handle(Event event) {
        if (UserEventType.fromValue(event.type()).isEmpty()) {
            log.error("Unknown user event type={} aggregate={}", event.type(), event.aggregateId());
            return;
        }
        repository.upsertProjection(repository.load(event.aggregateId()));
    }
}
