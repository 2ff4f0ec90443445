package com.geevly.file;

import com.geevly.eventsourcing.Event;
import com.geevly.projection.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class FileEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(FileEventHandler.class);

    private final FileRepository repository;

    public FileEventHandler(FileRepository repository) {
        this.repository = repository;
    }

    @Override
    public String stream() {
        return FileAggregate.STREAM;
    }

    @Override
    public void handle(Event event) {
        if (FileEventType.fromValue(event.type()).isEmpty()) {
            log.error("Unknown file event type={} aggregate={}", event.type(), event.aggregateId());
            return;
        }
        repository.upsertProjection(repository.load(event.aggregateId()));
    }
}
