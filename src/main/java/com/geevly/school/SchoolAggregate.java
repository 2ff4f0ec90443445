package com.geevly.school;

import com.geevly.eventsourcing.AggregateRoot;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.Event;
import com.geevly.eventsourcing.EventRouter;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.school.SchoolCommands.CreateSchool;
import com.geevly.school.SchoolCommands.SetActive;
import com.geevly.school.SchoolCommands.UpdateSchool;
import com.geevly.school.SchoolEvents.ActiveSet;
import com.geevly.school.SchoolEvents.Created;
import com.geevly.school.SchoolEvents.Updated;

import java.time.Clock;

public class SchoolAggregate extends AggregateRoot<SchoolAggregate> {

    public static final String STREAM = "school";

    private static final EventRouter<SchoolAggregate> ROUTER = EventRouter
        .<SchoolAggregate, SchoolEventType>builder(STREAM, SchoolEventType.class)
        .creation(SchoolEventType.CREATED, Created.class, (s, p, e) -> {
            s.created = true;
            s.active = true;
            s.setDetails(p.name(), p.principal(), p.contactNumber());
        })
        .on(SchoolEventType.UPDATED, Updated.class, (s, p, e) -> s.setDetails(p.name(), p.principal(), p.contactNumber()))
        .on(SchoolEventType.ACTIVE_SET, ActiveSet.class, (s, p, e) -> s.active = p.active())
        .build();

    private boolean created;
    private boolean active;
    private String name;
    private String principal;
    private String contactNumber;

    public SchoolAggregate(String id, PayloadCodec codec) {
        super(id, codec);
    }

    public SchoolAggregate(String id, PayloadCodec codec, Clock clock) {
        super(id, codec, clock);
    }

    @Override
    protected EventRouter<SchoolAggregate> router() {
        return ROUTER;
    }

    @Override
    protected SchoolAggregate self() {
        return this;
    }

    @Override
    public boolean exists() {
        return created;
    }

    public Event create(CreateSchool cmd) {
        requireCreatable();
        return raise(SchoolEventType.CREATED,
            new Created(requireName(cmd.name()), trim(cmd.principal()), trim(cmd.contactNumber())));
    }

    public Event update(UpdateSchool cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        return raise(SchoolEventType.UPDATED,
            new Updated(requireName(cmd.name()), trim(cmd.principal()), trim(cmd.contactNumber())));
    }

    public Event setActive(SetActive cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (cmd.active() == active) {
            throw new CommandValidationException("school " + getId() + " is already " + (active ? "active" : "inactive"));
        }
        return raise(SchoolEventType.ACTIVE_SET, new ActiveSet(cmd.active()));
    }

    private void setDetails(String name, String principal, String contactNumber) {
        this.name = name;
        this.principal = principal;
        this.contactNumber = contactNumber;
    }

    public boolean isActive() {
        return active;
    }

    public String getName() {
        return name;
    }

    public String getPrincipal() {
        return principal;
    }

    public String getContactNumber() {
        return contactNumber;
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new CommandValidationException("school must have a name");
        }
        return name.trim();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
