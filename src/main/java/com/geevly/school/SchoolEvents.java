package com.geevly.school;

public final class SchoolEvents {

    private SchoolEvents() {
    }

    public record Created(String name, String principal, String contactNumber) {}

    public record Updated(String name, String principal, String contactNumber) {}

    public record ActiveSet(boolean active) {}
}
