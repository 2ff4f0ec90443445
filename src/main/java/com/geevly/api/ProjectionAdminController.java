package com.geevly.api;

import com.geevly.projection.ProjectionRebuilder;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin/projections")
public class ProjectionAdminController {

    private final ProjectionRebuilder rebuilder;

    public ProjectionAdminController(ProjectionRebuilder rebuilder) {
        this.rebuilder = rebuilder;
    }

    @PostMapping("/{stream}/rebuild")
    public Map<String, Object> rebuild(@PathVariable String stream) {
        int aggregates = rebuilder.rebuild(stream);
        return Map.of("stream", stream, "aggregates", aggregates);
    }
}
