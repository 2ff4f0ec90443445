package com.geevly.eventsourcing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventStoreTest {

    private final InMemoryEventStore store = new InMemoryEventStore();

    private static Event event(String type, String aggregateId, long version) {
        return new Event(type, aggregateId, version, Instant.parse("2024-05-01T00:00:00Z").plusSeconds(version),
            ("{\"v\":" + version + "}").getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("appended events load back in version order")
    void appendAndLoad() {
        store.append("student", "1", List.of(event("AddStudent", "1", 1), event("UpdateStudent", "1", 2)));
        store.append("student", "1", List.of(event("FeedStudent", "1", 3)));

        List<Event> loaded = store.load("student", "1");
        assertEquals(3, loaded.size());
        assertEquals(List.of(1L, 2L, 3L), loaded.stream().map(Event::version).toList());
        assertEquals(3, store.currentVersion("student", "1"));
        assertEquals(Optional.of(event("UpdateStudent", "1", 2)), store.loadVersion("student", "1", 2));
    }

    @Test
    @DisplayName("streams are isolated from each other")
    void streamsAreIsolated() {
        store.append("student", "1", List.of(event("AddStudent", "1", 1)));
        store.append("school", "1", List.of(event("CreateSchool", "1", 1)));

        assertEquals(1, store.load("student", "1").size());
        assertEquals("CreateSchool", store.load("school", "1").get(0).type());
        assertEquals(List.of("1"), store.aggregateIds("school"));
    }

    @Test
    @DisplayName("stale version is a conflict and appends nothing")
    void staleVersionConflicts() {
        store.append("student", "1", List.of(event("AddStudent", "1", 1), event("UpdateStudent", "1", 2)));

        VersionConflictException ex = assertThrows(VersionConflictException.class,
            () -> store.append("student", "1", List.of(event("FeedStudent", "1", 2))));
        assertEquals(2, ex.getActualVersion());
        assertEquals(2, store.currentVersion("student", "1"));
    }

    @Test
    @DisplayName("batch with a gap is rejected as a whole")
    void nonContiguousBatchRejected() {
        store.append("student", "1", List.of(event("AddStudent", "1", 1)));

        assertThrows(VersionConflictException.class,
            () -> store.append("student", "1", List.of(event("UpdateStudent", "1", 2), event("FeedStudent", "1", 4))));
        assertEquals(1, store.load("student", "1").size());
    }

    @Test
    @DisplayName("query returns newest first and honours filters and limit")
    void queryNewestFirst() {
        store.append("student", "1", List.of(event("AddStudent", "1", 1), event("FeedStudent", "1", 2)));
        store.append("student", "2", List.of(event("AddStudent", "2", 1)));

        List<Event> all = store.query("student", Optional.empty(), Optional.empty(), 10);
        assertEquals("2", all.get(0).aggregateId());
        assertEquals(3, all.size());

        List<Event> created = store.query("student", Optional.of("AddStudent"), Optional.empty(), 10);
        assertEquals(2, created.size());

        List<Event> limited = store.query("student", Optional.empty(), Optional.of("1"), 1);
        assertEquals(1, limited.size());
        assertEquals("FeedStudent", limited.get(0).type());

        assertTrue(store.query("student", Optional.empty(), Optional.empty(), 0).isEmpty());
    }
}
