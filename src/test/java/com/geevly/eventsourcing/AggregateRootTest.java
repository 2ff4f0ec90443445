package com.geevly.eventsourcing;

import com.geevly.school.SchoolAggregate;
import com.geevly.school.SchoolCommands.CreateSchool;
import com.geevly.school.SchoolEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregateRootTest {

    private static final Instant FIXED = Instant.parse("2024-02-02T09:30:00Z");

    private final PayloadCodec codec = PayloadCodec.defaultCodec();

    enum CounterEventType implements EventType {
        OPENED("OpenCounter", Opened.class),
        STEPPED("StepCounter", Stepped.class);

        private final String value;
        private final Class<?> payloadType;

        CounterEventType(String value, Class<?> payloadType) {
            this.value = value;
            this.payloadType = payloadType;
        }

        @Override
        public String getValue() {
            return value;
        }

        @Override
        public Class<?> payloadType() {
            return payloadType;
        }
    }

    record Opened(String label) {}

    record Stepped(int by) {}

    static final class Counter extends AggregateRoot<Counter> {

        private static final EventRouter<Counter> ROUTER = EventRouter
            .<Counter, CounterEventType>builder("counter", CounterEventType.class)
            .creation(CounterEventType.OPENED, Opened.class, (c, p, e) -> c.label = p.label())
            .on(CounterEventType.STEPPED, Stepped.class, (c, p, e) -> {
                if (p.by() < 0) {
                    throw new IllegalStateException("negative step " + p.by());
                }
                c.total += p.by();
            })
            .build();

        private String label;
        private int total;

        Counter(String id, PayloadCodec codec, Clock clock) {
            super(id, codec, clock);
        }

        @Override
        protected EventRouter<Counter> router() {
            return ROUTER;
        }

        @Override
        protected Counter self() {
            return this;
        }

        @Override
        public boolean exists() {
            return label != null;
        }

        Event open(String name) {
            requireCreatable();
            return raise(CounterEventType.OPENED, new Opened(name));
        }
    }

    private Event stepped(long version, int by) {
        return new Event(CounterEventType.STEPPED.getValue(), "c-1", version, FIXED, codec.encode(new Stepped(by)));
    }

    @Nested
    @DisplayName("handler failures")
    class HandlerFailures {

        @Test
        @DisplayName("a runtime failure inside a handler names the event and leaves the version alone")
        void runtimeFailureBecomesEventApplicationException() {
            Counter counter = new Counter("c-1", codec, Clock.systemUTC());
            counter.open("hall");

            EventApplicationException ex = assertThrows(EventApplicationException.class,
                () -> counter.apply(stepped(2, -1)));
            assertInstanceOf(IllegalStateException.class, ex.getCause());
            assertTrue(ex.getMessage().contains("StepCounter v2"), ex.getMessage());
            assertTrue(ex.getMessage().contains("c-1"), ex.getMessage());
            assertEquals(1, counter.getVersion());
            assertEquals(0, counter.total);

            counter.apply(stepped(2, 3));
            assertEquals(2, counter.getVersion());
            assertEquals(3, counter.total);
        }

        @Test
        @DisplayName("domain failures pass through unwrapped")
        void domainFailurePassesThrough() {
            Counter counter = new Counter("c-1", codec, Clock.systemUTC());
            assertThrows(AggregateNotFoundException.class, () -> counter.apply(stepped(1, 1)));
        }
    }

    @Nested
    @DisplayName("payload decoding")
    class PayloadDecoding {

        @Test
        @DisplayName("a corrupted payload fails with a serialization error")
        void corruptedPayloadFailsToDecode() {
            byte[] garbage = "{\"by\": \"not a number\"".getBytes(StandardCharsets.UTF_8);
            assertThrows(PayloadSerializationException.class, () -> codec.decode(garbage, Stepped.class));
        }

        @Test
        @DisplayName("replaying a corrupted payload fails the load")
        void corruptedPayloadFailsReplay() {
            Counter counter = new Counter("c-1", codec, Clock.systemUTC());
            Event corrupted = new Event(CounterEventType.OPENED.getValue(), "c-1", 1, FIXED,
                "not json".getBytes(StandardCharsets.UTF_8));

            assertThrows(PayloadSerializationException.class, () -> counter.load(List.of(corrupted)));
            assertFalse(counter.exists());
            assertEquals(0, counter.getVersion());
        }
    }

    @Nested
    @DisplayName("event timestamps")
    class Timestamps {

        @Test
        @DisplayName("raised events are stamped by the aggregate's clock")
        void raisedEventsUseClock() {
            Counter counter = new Counter("c-1", codec, Clock.fixed(FIXED, ZoneOffset.UTC));
            assertEquals(FIXED, counter.open("hall").timestamp());
        }

        @Test
        @DisplayName("domain commands without an explicit time use the clock too")
        void schoolCommandsUseClock() {
            SchoolAggregate school = new SchoolAggregate("9", codec, Clock.fixed(FIXED, ZoneOffset.UTC));
            Event created = school.create(new CreateSchool("Clocked", null, null));

            assertEquals(SchoolEventType.CREATED.getValue(), created.type());
            assertEquals(FIXED, created.timestamp());
        }
    }
}
