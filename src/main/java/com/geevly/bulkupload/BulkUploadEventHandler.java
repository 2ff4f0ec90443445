package com.geevly.bulkupload;

import com.geevly.eventsourcing.Event;
import com.geevly.projection.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class BulkUploadEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(BulkUploadEventHandler.class);

    private final BulkUploadRepository repository;

    public BulkUploadEventHandler(BulkUploadRepository repository) {
        this.repository = repository;
    }

    @Override
    public String stream() {
        return BulkUploadAggregate.STREAM;
    }

    @Override
    public void handle(Event event) {
        if (BulkUploadEventType.fromValue(event.type()).isEmpty()) {
            log.error("Unknown bulk upload event type={} aggregate={}", event.type(), event.aggregateId());
            return;
        }
        repository.upsertProjection(repository.load(event.aggregateId()));
    }
}
