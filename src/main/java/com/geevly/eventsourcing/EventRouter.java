package com.geevly.eventsourcing;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Closed dispatch table from event-type wire name to typed payload and handler.
 *
 * <p>Built once per aggregate class. {@link Builder#build()} refuses a table that leaves any
 * constant of the event-type enum without a route, so an aggregate can never meet a type it
 * declares but does not handle.
 */
public final class EventRouter<A extends AggregateRoot<A>> {

    @FunctionalInterface
    public interface Handler<A, P> {
        void handle(A aggregate, P payload, Event event);
    }

    private record Route<A, P>(Class<P> payloadType, Handler<A, P> handler) {

        void invoke(A aggregate, Event event, PayloadCodec codec) {
            handler.handle(aggregate, codec.decode(event.payload(), payloadType), event);
        }
    }

    private final String stream;
    private final String creationType;
    private final Map<String, Route<A, ?>> routes;

    private EventRouter(String stream, String creationType, Map<String, Route<A, ?>> routes) {
        this.stream = stream;
        this.creationType = creationType;
        this.routes = Collections.unmodifiableMap(routes);
    }

    public static <A extends AggregateRoot<A>, T extends Enum<T> & EventType> Builder<A, T> builder(
        String stream, Class<T> eventTypes) {
        return new Builder<>(stream, eventTypes);
    }

    public String stream() {
        return stream;
    }

    public boolean isCreation(String type) {
        return creationType.equals(type);
    }

    public Set<String> types() {
        return routes.keySet();
    }

    void route(A aggregate, Event event, PayloadCodec codec) {
        Route<A, ?> route = routes.get(event.type());
        if (route == null) {
            throw new UnknownEventTypeException(stream, event.type());
        }
        boolean creation = isCreation(event.type());
        if (creation && aggregate.exists()) {
            throw new AggregateAlreadyExistsException(stream, aggregate.getId());
        }
        if (!creation && !aggregate.exists()) {
            throw new AggregateNotFoundException(stream, aggregate.getId());
        }
        route.invoke(aggregate, event, codec);
    }

    public static final class Builder<A extends AggregateRoot<A>, T extends Enum<T> & EventType> {

        private final String stream;
        private final Class<T> eventTypes;
        private final Map<String, Route<A, ?>> routes = new LinkedHashMap<>();
        private T creation;

        private Builder(String stream, Class<T> eventTypes) {
            this.stream = Objects.requireNonNull(stream, "stream");
            this.eventTypes = Objects.requireNonNull(eventTypes, "eventTypes");
        }

        public <P> Builder<A, T> creation(T type, Class<P> payloadType, Handler<A, P> handler) {
            if (creation != null) {
                throw new IllegalStateException(stream + " already has creation event " + creation.getValue());
            }
            creation = type;
            return on(type, payloadType, handler);
        }

        public <P> Builder<A, T> on(T type, Class<P> payloadType, Handler<A, P> handler) {
            if (!type.payloadType().equals(payloadType)) {
                throw new IllegalArgumentException(type.getValue() + " carries " + type.payloadType().getSimpleName()
                    + ", not " + payloadType.getSimpleName());
            }
            if (routes.putIfAbsent(type.getValue(), new Route<>(payloadType, handler)) != null) {
                throw new IllegalStateException("duplicate route for " + type.getValue());
            }
            return this;
        }

        public EventRouter<A> build() {
            if (creation == null) {
                throw new IllegalStateException(stream + " router has no creation event");
            }
            Set<String> missing = EnumSet.allOf(eventTypes).stream()
                .map(EventType::getValue)
                .filter(v -> !routes.containsKey(v))
                .collect(Collectors.toCollection(TreeSet::new));
            if (!missing.isEmpty()) {
                throw new IllegalStateException(stream + " router is missing routes for " + missing);
            }
            return new EventRouter<>(stream, creation.getValue(), new LinkedHashMap<>(routes));
        }
    }
}
