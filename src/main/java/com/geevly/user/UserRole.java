package com.geevly.user;

public record UserRole(long roleId, String role) {}
