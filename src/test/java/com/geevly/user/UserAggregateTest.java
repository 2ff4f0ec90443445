package com.geevly.user;

import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.NotFoundException;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.user.UserCommands.AddRole;
import com.geevly.user.UserCommands.ChangePassword;
import com.geevly.user.UserCommands.CreateUser;
import com.geevly.user.UserCommands.RemoveRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class UserAggregateTest {

    private UserAggregate user;

    @BeforeEach
    void create() {
        user = new UserAggregate("11", PayloadCodec.defaultCodec());
        user.create(new CreateUser("Jo", "Ramos", " Jo.Ramos@Example.org "));
    }

    @Test
    @DisplayName("email is normalised and new users are active")
    void created() {
        assertEquals("jo.ramos@example.org", user.getEmail());
        assertTrue(user.isActive());
    }

    @Test
    @DisplayName("invalid email is rejected")
    void invalidEmail() {
        UserAggregate other = new UserAggregate("12", PayloadCodec.defaultCodec());
        assertThrows(CommandValidationException.class, () -> other.create(new CreateUser("Jo", "Ramos", "not-an-email")));
    }

    @Test
    @DisplayName("roles are added once and removed by name")
    void roles() {
        user.addRole(new AddRole(1, "Admin"));
        assertTrue(user.hasRole("admin"));
        assertThrows(CommandValidationException.class, () -> user.addRole(new AddRole(2, "admin")));

        user.addRole(new AddRole(2, "teacher"));
        assertEquals(2, user.getRoles().size());
        assertEquals(2, user.getRoles().get(1).roleId());

        user.removeRole(new RemoveRole(3, "admin"));
        assertFalse(user.hasRole("admin"));
        assertThrows(NotFoundException.class, () -> user.removeRole(new RemoveRole(4, "admin")));
    }

    @Test
    @DisplayName("password change records when it happened")
    void passwordChanged() {
        Instant now = Instant.parse("2024-04-01T09:00:00Z");
        user.changePassword(new ChangePassword(1), now);
        assertEquals(now, user.getPasswordChangedAt());
    }
}
