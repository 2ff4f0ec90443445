package com.geevly.school;

import com.geevly.eventsourcing.EventType;

import java.util.Arrays;
import java.util.Optional;

public enum SchoolEventType implements EventType {
    CREATED("CreateSchool", SchoolEvents.Created.class),
    UPDATED("UpdateSchool", SchoolEvents.Updated.class),
    ACTIVE_SET("SetSchoolActive", SchoolEvents.ActiveSet.class);

    private final String value;
    private final Class<?> payloadType;

    SchoolEventType(String value, Class<?> payloadType) {
        this.value = value;
        this.payloadType = payloadType;
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public Class<?> payloadType() {
        return payloadType;
    }

    public static Optional<SchoolEventType> fromValue(String raw) {
        return Arrays.stream(values()).filter(v -> v.value.equals(raw)).findFirst();
    }
}
