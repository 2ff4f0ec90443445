package com.geevly.eventsourcing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class JdbcIdAllocatorTest {

    @Autowired IdAllocator allocator;

    @Test
    @DisplayName("ids are sequential per type starting at 1")
    void sequentialPerType() {
        String type = "alloc-" + UUID.randomUUID();
        String other = "alloc-" + UUID.randomUUID();

        assertEquals(1, allocator.nextId(type));
        assertEquals(2, allocator.nextId(type));
        assertEquals(1, allocator.nextId(other));
        assertEquals(3, allocator.nextId(type));
    }

    @Test
    @DisplayName("concurrent callers never receive the same id")
    void concurrentCallersGetDistinctIds() throws Exception {
        String type = "alloc-" + UUID.randomUUID();
        allocator.nextId(type);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<Long>>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(pool.submit(() -> {
                    List<Long> ids = new ArrayList<>();
                    for (int i = 0; i < 20; i++) {
                        ids.add(allocator.nextId(type));
                    }
                    return ids;
                }));
            }
            Set<Long> seen = new HashSet<>();
            for (Future<List<Long>> future : futures) {
                for (Long id : future.get()) {
                    assertTrue(seen.add(id), "duplicate id " + id);
                }
            }
            assertEquals(80, seen.size());
        } finally {
            pool.shutdownNow();
        }
    }
}
