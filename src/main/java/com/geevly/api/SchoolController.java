package com.geevly.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.geevly.eventsourcing.PayloadCodec;
import com.geevly.projection.PagedResult;
import com.geevly.school.ProjectedSchool;
import com.geevly.school.SchoolCommands.CreateSchool;
import com.geevly.school.SchoolCommands.SetActive;
import com.geevly.school.SchoolCommands.UpdateSchool;
import com.geevly.school.SchoolService;
import com.geevly.student.ProjectedStudent;
import com.geevly.student.StudentService;
import org.springframework.http.HttpStatus;
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
@RequestMapping("/api/v1/schools")
public class SchoolController {

    private final SchoolService schools;
    private final StudentService students;
    private final PayloadCodec codec;

    public SchoolController(SchoolService schools, StudentService students, PayloadCodec codec) {
        this.schools = schools;
        this.students = students;
        this.codec = codec;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CommandResult create(@RequestBody SchoolRequest request) {
        return CommandResult.of(schools.createSchool(
            new CreateSchool(request.name(), request.principal(), request.contactNumber())));
    }

    @GetMapping
    public PagedResult<ProjectedSchool> list(@RequestParam(required = false) Integer limit,
                                             @RequestParam(required = false) Integer page) {
        return schools.list(limit, page);
    }

    @GetMapping("/{id}")
    public ProjectedSchool get(@PathVariable String id) {
        return schools.getProjected(id);
    }

    @GetMapping("/{id}/history")
    public List<EventView> history(@PathVariable String id) {
        return schools.history(id).stream().map(e -> EventView.of(e, codec)).toList();
    }

    @GetMapping("/{id}/students")
    public List<ProjectedStudent> students(@PathVariable String id) {
        schools.getProjected(id);
        return students.listForSchool(id);
    }

    @PutMapping("/{id}")
    public CommandResult update(@PathVariable String id, @RequestBody SchoolRequest request) {
        return CommandResult.of(schools.update(id, new UpdateSchool(request.expectedVersion(), request.name(),
            request.principal(), request.contactNumber())));
    }

    @PostMapping("/{id}/active")
    public CommandResult setActive(@PathVariable String id, @RequestBody ActiveRequest request) {
        return CommandResult.of(schools.setActive(id, new SetActive(request.expectedVersion(), request.active())));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SchoolRequest(long expectedVersion, String name, String principal, String contactNumber) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ActiveRequest(long expectedVersion, boolean active) {}
}
