package com.geevly.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.projection.PagedResult;
import com.geevly.user.ProjectedUser;
import com.geevly.user.UserCommands.AddRole;
import com.geevly.user.UserCommands.ChangePassword;
import com.geevly.user.UserCommands.CreateUser;
import com.geevly.user.UserCommands.RemoveRole;
import com.geevly.user.UserCommands.SetActiveState;
import com.geevly.user.UserCommands.UpdateUser;
import com.geevly.user.UserService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private final UserService users;
    private final PayloadCodec codec;

    public UserController(UserService users, PayloadCodec codec) {
        this.users = users;
        this.codec = codec;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CommandResult create(@RequestBody UserRequest request) {
        return CommandResult.of(users.createUser(
            new CreateUser(request.firstName(), request.lastName(), request.email())));
    }

    @GetMapping
    public PagedResult<ProjectedUser> list(@RequestParam(required = false) Integer limit,
                                           @RequestParam(required = false) Integer page) {
        return users.list(limit, page);
    }

    @GetMapping("/{id}")
    public ProjectedUser get(@PathVariable String id) {
        return users.getProjected(id);
    }

    @GetMapping("/{id}/history")
    public List<EventView> history(@PathVariable String id) {
        return users.history(id).stream().map(e -> EventView.of(e, codec)).toList();
    }

    @PutMapping("/{id}")
    public CommandResult update(@PathVariable String id, @RequestBody UserRequest request) {
        return CommandResult.of(users.update(id, new UpdateUser(request.expectedVersion(), request.firstName(),
            request.lastName(), request.email())));
    }

    @PostMapping("/{id}/password")
    public CommandResult changePassword(@PathVariable String id, @RequestBody VersionRequest request) {
        return CommandResult.of(users.changePassword(id, new ChangePassword(request.expectedVersion())));
    }

    @PostMapping("/{id}/active")
    public CommandResult setActive(@PathVariable String id, @RequestBody ActiveRequest request) {
        return CommandResult.of(users.setActiveState(id, new SetActiveState(request.expectedVersion(), request.active())));
    }

    @PostMapping("/{id}/roles")
    public CommandResult addRole(@PathVariable String id, @RequestBody RoleRequest request) {
        return CommandResult.of(users.addRole(id, new AddRole(request.expectedVersion(), request.role())));
    }

    @DeleteMapping("/{id}/roles/{role}")
    public CommandResult removeRole(@PathVariable String id,
                                    @PathVariable String role,
                                    @RequestParam("expected_version") long expectedVersion) {
        return CommandResult.of(users.removeRole(id, new RemoveRole(expectedVersion, role)));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record UserRequest(long expectedVersion, String firstName, String lastName, String email) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record VersionRequest(long expectedVersion) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ActiveRequest(long expectedVersion, boolean active) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RoleRequest(long expectedVersion, String role) {}
}
