package com.geevly.user;

import java.time.Instant;

public final class UserEvents {

    private UserEvents() {
    }

    public record Added(String firstName, String lastName, String email, boolean active) {}

    public record Updated(String firstName, String lastName, String email) {}

    public record PasswordChanged(Instant changedAt) {}

    public record ActiveStateSet(boolean active) {}

    public record RoleAdded(long roleId, String role) {}

    public record RoleRemoved(long roleId) {}
}
