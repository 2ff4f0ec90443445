package com.geevly.projection;

import com.geevly.eventsourcing.EventSourcedRepository;
import com.geevly.eventsourcing.NotFoundException;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replays a whole stream into its projection tables.
 */
@Service
public class ProjectionRebuilder {

    private final Map<String, EventSourcedRepository<?>> repositories = new LinkedHashMap<>();

    public ProjectionRebuilder(List<EventSourcedRepository<?>> repositories) {
        for (EventSourcedRepository<?> repository : repositories) {
            this.repositories.put(repository.stream(), repository);
        }
    }

    public Set<String> streams() {
        return repositories.keySet();
    }

    public int rebuild(String stream) {
        EventSourcedRepository<?> repository = repositories.get(stream);
        if (repository == null) {
            throw new NotFoundException("unknown stream " + stream);
        }
        return repository.rebuildProjections();
    }
}
