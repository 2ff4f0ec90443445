package com.geevly.school;

public final class SchoolCommands {

    private SchoolCommands() {
    }

    public record CreateSchool(String name, String principal, String contactNumber) {}

    public record UpdateSchool(long expectedVersion, String name, String principal, String contactNumber) {}

    public record SetActive(long expectedVersion, boolean active) {}
}
