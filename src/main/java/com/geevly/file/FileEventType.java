package com.geevly.file;

import com.geevly.eventsourcing.EventType;

import java.util.Arrays;
import java.util.Optional;

public enum FileEventType implements EventType {
    CREATED("FileCreated", FileEvents.Created.class),
    DELETED("FileDeleted", FileEvents.Deleted.class);

    private final String value;
    private final Class<?> payloadType;

    FileEventType(String value, Class<?> payloadType) {
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

    public static Optional<FileEventType> fromValue(String raw) {
        return Arrays.stream(values()).filter(v -> v.value.equals(raw)).findFirst();
    }
}
