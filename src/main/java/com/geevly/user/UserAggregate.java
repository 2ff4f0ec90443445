package com.geevly.user;

import com.geevly.eventsourcing.AggregateRoot;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.Event;
import com.geevly.eventsourcing.EventRouter;
import com.geevly.eventsourcing.NotFoundException;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.user.UserCommands.AddRole;
import com.geevly.user.UserCommands.ChangePassword;
import com.geevly.user.UserCommands.CreateUser;
import com.geevly.user.UserCommands.RemoveRole;
import com.geevly.user.UserCommands.SetActiveState;
import com.geevly.user.UserCommands.UpdateUser;
import com.geevly.user.UserEvents.ActiveStateSet;
import com.geevly.user.UserEvents.Added;
import com.geevly.user.UserEvents.PasswordChanged;
import com.geevly.user.UserEvents.RoleAdded;
import com.geevly.user.UserEvents.RoleRemoved;
import com.geevly.user.UserEvents.Updated;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

public class UserAggregate extends AggregateRoot<UserAggregate> {

    public static final String STREAM = "user";

    private static final Pattern EMAIL = Pattern.compile("^[^@\\s]+@[^@\\s]+\\.[^@\\s]+$");

    private static final EventRouter<UserAggregate> ROUTER = EventRouter
        .<UserAggregate, UserEventType>builder(STREAM, UserEventType.class)
        .creation(UserEventType.ADDED, Added.class, UserAggregate::onAdded)
        .on(UserEventType.UPDATED, Updated.class, UserAggregate::onUpdated)
        .on(UserEventType.PASSWORD_CHANGED, PasswordChanged.class, (u, p, e) -> u.passwordChangedAt = p.changedAt())
        .on(UserEventType.ACTIVE_STATE_SET, ActiveStateSet.class, (u, p, e) -> u.active = p.active())
        .on(UserEventType.ROLE_ADDED, RoleAdded.class, UserAggregate::onRoleAdded)
        .on(UserEventType.ROLE_REMOVED, RoleRemoved.class, (u, p, e) -> u.roles.removeIf(r -> r.roleId() == p.roleId()))
        .build();

    private boolean created;
    private String firstName;
    private String lastName;
    private String email;
    private boolean active;
    private Instant passwordChangedAt;
    private long nextRoleId = 1;
    private final List<UserRole> roles = new ArrayList<>();

    public UserAggregate(String id, PayloadCodec codec) {
        super(id, codec);
    }

    public UserAggregate(String id, PayloadCodec codec, Clock clock) {
        super(id, codec, clock);
    }

    @Override
    protected EventRouter<UserAggregate> router() {
        return ROUTER;
    }

    @Override
    protected UserAggregate self() {
        return this;
    }

    @Override
    public boolean exists() {
        return created;
    }

    public Event create(CreateUser cmd) {
        requireCreatable();
        requireName(cmd.firstName(), cmd.lastName());
        return raise(UserEventType.ADDED,
            new Added(cmd.firstName().trim(), cmd.lastName().trim(), normalizeEmail(cmd.email()), true));
    }

    public Event update(UpdateUser cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        requireName(cmd.firstName(), cmd.lastName());
        return raise(UserEventType.UPDATED,
            new Updated(cmd.firstName().trim(), cmd.lastName().trim(), normalizeEmail(cmd.email())));
    }

    public Event changePassword(ChangePassword cmd, Instant now) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        return raise(UserEventType.PASSWORD_CHANGED, new PasswordChanged(now), now);
    }

    public Event setActiveState(SetActiveState cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        return raise(UserEventType.ACTIVE_STATE_SET, new ActiveStateSet(cmd.active()));
    }

    public Event addRole(AddRole cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        if (cmd.role() == null || cmd.role().isBlank()) {
            throw new CommandValidationException("role is required");
        }
        String role = cmd.role().trim().toLowerCase(Locale.ROOT);
        if (hasRole(role)) {
            throw new CommandValidationException("user " + getId() + " already has role " + role);
        }
        return raise(UserEventType.ROLE_ADDED, new RoleAdded(nextRoleId, role));
    }

    public Event removeRole(RemoveRole cmd) {
        requireExists();
        checkExpectedVersion(cmd.expectedVersion());
        String role = cmd.role() == null ? "" : cmd.role().trim().toLowerCase(Locale.ROOT);
        UserRole existing = roles.stream()
            .filter(r -> r.role().equals(role))
            .findFirst()
            .orElseThrow(() -> new NotFoundException("user " + getId() + " does not have role " + role));
        return raise(UserEventType.ROLE_REMOVED, new RoleRemoved(existing.roleId()));
    }

    private void onAdded(Added p, Event e) {
        created = true;
        firstName = p.firstName();
        lastName = p.lastName();
        email = p.email();
        active = p.active();
    }

    private void onUpdated(Updated p, Event e) {
        firstName = p.firstName();
        lastName = p.lastName();
        email = p.email();
    }

    private void onRoleAdded(RoleAdded p, Event e) {
        roles.add(new UserRole(p.roleId(), p.role()));
        nextRoleId = Math.max(nextRoleId, p.roleId() + 1);
    }

    public boolean hasRole(String role) {
        return roles.stream().anyMatch(r -> r.role().equals(role));
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getEmail() {
        return email;
    }

    public boolean isActive() {
        return active;
    }

    public Instant getPasswordChangedAt() {
        return passwordChangedAt;
    }

    public List<UserRole> getRoles() {
        return List.copyOf(roles);
    }

    private static void requireName(String firstName, String lastName) {
        if (firstName == null || firstName.isBlank() || lastName == null || lastName.isBlank()) {
            throw new CommandValidationException("first and last name are required");
        }
    }

    private static String normalizeEmail(String email) {
        if (email == null || !EMAIL.matcher(email.trim()).matches()) {
            throw new CommandValidationException("a valid email is required");
        }
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
