package com.geevly.eventsourcing;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Identity, version and replay shared by every aggregate.
 *
 * <p>State only changes through {@link #apply(Event)}: replay feeds stored events in, and command
 * methods call {@link #raise} which builds the next event and applies it. A command that fails
 * validation throws before raising anything, leaving the aggregate untouched.
 */
public abstract class AggregateRoot<A extends AggregateRoot<A>> {

    private final String id;
    private final PayloadCodec codec;
    private final Clock clock;
    private long version;

    protected AggregateRoot(String id, PayloadCodec codec) {
        this(id, codec, Clock.systemUTC());
    }

    protected AggregateRoot(String id, PayloadCodec codec, Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    protected abstract EventRouter<A> router();

    protected abstract A self();

    /**
     * Whether the creation event has been applied.
     */
    public abstract boolean exists();

    public String getId() {
        return id;
    }

    public long getVersion() {
        return version;
    }

    public String stream() {
        return router().stream();
    }

    public final void load(List<Event> history) {
        for (Event event : history) {
            apply(event);
        }
    }

    public final void apply(Event event) {
        if (!id.equals(event.aggregateId())) {
            throw new IllegalArgumentException("event for " + event.aggregateId() + " applied to " + id);
        }
        if (event.version() != version + 1) {
            throw new VersionConflictException(id, version + 1, event.version());
        }
        try {
            router().route(self(), event, codec);
        } catch (DomainException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new EventApplicationException(event, ex);
        }
        version = event.version();
    }

    protected final Event raise(EventType type, Object payload) {
        return raise(type, payload, clock.instant());
    }

    protected final Event raise(EventType type, Object payload, Instant timestamp) {
        Event event = new Event(type.getValue(), id, version + 1, timestamp, codec.encode(payload));
        apply(event);
        return event;
    }

    protected final void checkExpectedVersion(long expectedVersion) {
        if (expectedVersion != version) {
            throw new VersionConflictException(id, expectedVersion, version);
        }
    }

    protected void requireExists() {
        if (!exists()) {
            throw new AggregateNotFoundException(stream(), id);
        }
    }

    protected final void requireCreatable() {
        if (exists()) {
            throw new AggregateAlreadyExistsException(stream(), id);
        }
    }
}
