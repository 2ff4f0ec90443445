package com.geevly.school;

import com.geevly.config.GeevlyProperties;
import com.geevly.eventsourcing.AggregateNotFoundException;
import com.geevly.eventsourcing.CommandValidationException;
import com.geevly.eventsourcing.EventSourcedService;
import com.geevly.eventsourcing.IdAllocator;
import com.geevly.projection.PagedResult;
import com.geevly.projection.Paging;
import com.geevly.projection.ProjectionDispatcher;
import com.geevly.projection.RefreshMode;
import com.geevly.school.SchoolCommands.CreateSchool;
import com.geevly.school.SchoolCommands.SetActive;
import com.geevly.school.SchoolCommands.UpdateSchool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class SchoolService extends EventSourcedService<SchoolAggregate> {

    private static final Logger log = LoggerFactory.getLogger(SchoolService.class);

    private final SchoolRepository schools;
    private final IdAllocator idAllocator;
    private final int maxPageSize;

    public SchoolService(SchoolRepository schools,
                         ProjectionDispatcher dispatcher,
                         IdAllocator idAllocator,
                         GeevlyProperties properties) {
        super(schools, dispatcher);
        this.schools = schools;
        this.idAllocator = idAllocator;
        this.maxPageSize = properties.paging().maxPageSize();
    }

    public SchoolAggregate createSchool(CreateSchool cmd) {
        String id = String.valueOf(idAllocator.nextId(SchoolAggregate.STREAM));
        SchoolAggregate school = create(id, s -> s.create(cmd), RefreshMode.SYNC);
        log.info("Created school id={} name={}", id, school.getName());
        return school;
    }

    public SchoolAggregate update(String id, UpdateSchool cmd) {
        return execute(id, s -> s.update(cmd), RefreshMode.SYNC);
    }

    public SchoolAggregate setActive(String id, SetActive cmd) {
        return execute(id, s -> s.setActive(cmd), RefreshMode.SYNC);
    }

    public ProjectedSchool getProjected(String id) {
        return schools.findProjected(id).orElseThrow(() -> new AggregateNotFoundException(SchoolAggregate.STREAM, id));
    }

    public PagedResult<ProjectedSchool> list(Integer limit, Integer page) {
        return schools.list(Paging.of(limit, page, maxPageSize));
    }

    /**
     * Passes when the school exists and is active.
     */
    public void validateSchoolId(String id) {
        ProjectedSchool school = getProjected(id);
        if (!school.active()) {
            throw new CommandValidationException("school " + id + " is not active");
        }
    }

    public Map<String, ProjectedSchool> mapSchoolsById(Collection<String> ids) {
        Map<String, ProjectedSchool> byId = new LinkedHashMap<>();
        schools.findAll(ids).forEach(s -> byId.put(s.id(), s));
        return byId;
    }
}
