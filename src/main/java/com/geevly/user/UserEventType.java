package com.geevly.user;

import com.geevly.eventsourcing.EventType;

import java.util.Arrays;
import java.util.Optional;

public enum UserEventType implements EventType {
    ADDED("UserAdded", UserEvents.Added.class),
    UPDATED("UserUpdated", UserEvents.Updated.class),
    PASSWORD_CHANGED("UserPasswordChanged", UserEvents.PasswordChanged.class),
    ACTIVE_STATE_SET("UserSetActiveState", UserEvents.ActiveStateSet.class),
    ROLE_ADDED("UserAddRole", UserEvents.RoleAdded.class),
    ROLE_REMOVED("UserRemoveRole", UserEvents.RoleRemoved.class);

    private final String value;
    private final Class<?> payloadType;

    UserEventType(String value, Class<?> payloadType) {
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

    public static Optional<UserEventType> fromValue(String raw) {
        return Arrays.stream(values()).filter(v -> v.value.equals(raw)).findFirst();
    }
}
