package com.geevly.student;

import com.geevly.eventsourcing.Event;
import com.geevly.projection.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Reloads the student from the log and rewrites its projection tables.
 */
@Component
public class StudentEventHandler implements EventHandler {

    private static final Logger log = LoggerFactory.getLogger(StudentEventHandler.class);

    private final StudentRepository repository;
    private final TransactionTemplate transactionTemplate;

    public StudentEventHandler(StudentRepository repository, TransactionTemplate transactionTemplate) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
    }

    @Override
    public String stream() {
        return StudentAggregate.STREAM;
    }

    @Override
    public void handle(Event event) {
        if (StudentEventType.fromValue(event.type()).isEmpty()) {
            log.error("Unknown student event type={} aggregate={}", event.type(), event.aggregateId());
            return;
        }
        StudentAggregate student = repository.load(event.aggregateId());
        // all tables, not just the event's: a skipped out-of-order refresh must not leave one behind
        transactionTemplate.executeWithoutResult(status -> repository.upsertProjection(student));
    }
}
