package com.geevly.api;

import com.geevly.config.GeevlyProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/build-info")
public class BuildInfoController {

    private final GeevlyProperties.Build build;

    public BuildInfoController(GeevlyProperties properties) {
        this.build = properties.build();
    }

    @GetMapping
    public Map<String, Object> buildInfo() {
        return Map.of("version", build.version(), "commit", build.commit());
    }
}
