package com.geevly.eventsourcing;

import com.geevly.projection.ProjectionDispatcher;
import com.geevly.projection.RefreshMode;

import java.util.List;
import java.util.function.Function;

/**
 * Load, run one command, save, refresh. Subclasses expose the domain's use cases on top of
 * {@link #create} and {@link #execute}.
 */
public abstract class EventSourcedService<A extends AggregateRoot<A>> {

    protected final EventSourcedRepository<A> repository;
    protected final ProjectionDispatcher dispatcher;

    protected EventSourcedService(EventSourcedRepository<A> repository, ProjectionDispatcher dispatcher) {
        this.repository = repository;
        this.dispatcher = dispatcher;
    }

    public A get(String id) {
        return repository.load(id);
    }

    public List<Event> history(String id) {
        return repository.history(id);
    }

    public Event event(String id, long version) {
        return repository.event(id, version);
    }

    protected A create(String id, Function<A, Event> command) {
        return create(id, command, null);
    }

    protected A create(String id, Function<A, Event> command, RefreshMode mode) {
        A aggregate = repository.newAggregate(id);
        return commit(aggregate, command.apply(aggregate), mode);
    }

    protected A execute(String id, Function<A, Event> command) {
        return execute(id, command, null);
    }

    protected A execute(String id, Function<A, Event> command, RefreshMode mode) {
        A aggregate = repository.load(id);
        return commit(aggregate, command.apply(aggregate), mode);
    }

    private A commit(A aggregate, Event event, RefreshMode mode) {
        List<Event> events = List.of(event);
        repository.save(aggregate.getId(), events);
        if (mode == null) {
            dispatcher.publish(repository.stream(), events);
        } else {
            dispatcher.publish(repository.stream(), events, mode);
        }
        return aggregate;
    }
}
