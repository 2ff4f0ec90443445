package com.geevly.user;

public final class UserCommands {

    private UserCommands() {
    }

    public record CreateUser(String firstName, String lastName, String email) {}

    public record UpdateUser(long expectedVersion, String firstName, String lastName, String email) {}

    public record ChangePassword(long expectedVersion) {}

    public record SetActiveState(long expectedVersion, boolean active) {}

    public record AddRole(long expectedVersion, String role) {}

    public record RemoveRole(long expectedVersion, String role) {}
}
