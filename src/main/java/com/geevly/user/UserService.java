package com.geevly.user;

import com.geevly.config.GeevlyProperties;
import com.geevly.eventsourcing.AggregateNotFoundException;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.EventSourcedService;
import com.geevly.eventsourcing.IdAllocator;
import com.geevly.projection.PagedResult;
import com.geevly.projection.Paging;
import com.geevly.projection.ProjectionDispatcher;
import com.geevly.projection.RefreshMode;
import com.geevly.user.UserCommands.AddRole;
import com.geevly.user.UserCommands.ChangePassword;
import com.geevly.user.UserCommands.CreateUser;
import com.geevly.user.UserCommands.RemoveRole;
import com.geevly.user.UserCommands.SetActiveState;
import com.geevly.user.UserCommands.UpdateUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;

@Service
public class UserService extends EventSourcedService<UserAggregate> {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final UserRepository users;
    private final IdAllocator idAllocator;
    private final Clock clock;
    private final int maxPageSize;

    public UserService(UserRepository users,
                       ProjectionDispatcher dispatcher,
                       IdAllocator idAllocator,
                       Clock clock,
                       GeevlyProperties properties) {
        super(users, dispatcher);
        this.users = users;
        this.idAllocator = idAllocator;
        this.clock = clock;
        this.maxPageSize = properties.paging().maxPageSize();
    }

    public UserAggregate createUser(CreateUser cmd) {
        requireUnusedEmail(cmd.email(), null);
        String id = String.valueOf(idAllocator.nextId(UserAggregate.STREAM));
        UserAggregate user = create(id, u -> u.create(cmd), RefreshMode.SYNC);
        log.info("Created user id={}", id);
        return user;
    }

    public UserAggregate update(String id, UpdateUser cmd) {
        requireUnusedEmail(cmd.email(), id);
        return execute(id, u -> u.update(cmd), RefreshMode.SYNC);
    }

    public UserAggregate changePassword(String id, ChangePassword cmd) {
        return execute(id, u -> u.changePassword(cmd, clock.instant()));
    }

    public UserAggregate setActiveState(String id, SetActiveState cmd) {
        return execute(id, u -> u.setActiveState(cmd));
    }

    public UserAggregate addRole(String id, AddRole cmd) {
        return execute(id, u -> u.addRole(cmd));
    }

    public UserAggregate removeRole(String id, RemoveRole cmd) {
        return execute(id, u -> u.removeRole(cmd));
    }

    public ProjectedUser getProjected(String id) {
        return users.findProjected(id).orElseThrow(() -> new AggregateNotFoundException(UserAggregate.STREAM, id));
    }

    public PagedResult<ProjectedUser> list(Integer limit, Integer page) {
        return users.list(Paging.of(limit, page, maxPageSize));
    }

    /**
     * Passes when the user exists and is active.
     */
    public void validateUserId(String id) {
        if (!getProjected(id).active()) {
            throw new CommandValidationException("user " + id + " is not active");
        }
    }

    private void requireUnusedEmail(String email, String userId) {
        if (email == null) {
            return;
        }
        Optional<String> owner = users.findIdByEmail(email.trim().toLowerCase(Locale.ROOT));
        if (owner.isPresent() && !owner.get().equals(userId)) {
            throw new CommandValidationException("email is already used by another user");
        }
    }
}
