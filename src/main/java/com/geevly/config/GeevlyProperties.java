package com.geevly.config;

import com.geevly.projection.RefreshMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.ZoneId;

/**
 * Settings bound from the {@code geevly.*} prefix.
 *
 * <pre>
 * geevly:
 *   build:
 *     version: 1.4.0
 *     commit: 3f2c1ab
 *   feeding:
 *     zone: Asia/Manila
 *   projections:
 *     mode: async
 *   files:
 *     root: /var/lib/geevly/files
 *   paging:
 *     max-page-size: 100
 * </pre>
 *
 * @param build immutable build stamp reported by the build-info endpoint
 * @param feeding feeding rules; {@code zone} decides what counts as one calendar day
 * @param projections default projection refresh mode
 * @param files local file storage root
 * @param paging upper bound for list page sizes
 */
@ConfigurationProperties(prefix = "geevly")
@Validated
public record GeevlyProperties(@Valid Build build,
                               @Valid Feeding feeding,
                               @Valid Projections projections,
                               @Valid Files files,
                               @Valid PagingLimits paging) {

    public GeevlyProperties {
        if (build == null) {
            build = new Build(null, null);
        }
        if (feeding == null) {
            feeding = new Feeding(null);
        }
        if (projections == null) {
            projections = new Projections(null);
        }
        if (files == null) {
            files = new Files(null);
        }
        if (paging == null) {
            paging = new PagingLimits(0);
        }
    }

    public record Build(String version, String commit) {

        public Build {
            if (version == null || version.isBlank()) {
                version = "dev";
            }
            if (commit == null || commit.isBlank()) {
                commit = "unknown";
            }
        }
    }

    public record Feeding(String zone) {

        public Feeding {
            if (zone == null || zone.isBlank()) {
                zone = "UTC";
            }
        }

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    public record Projections(RefreshMode mode) {

        public Projections {
            if (mode == null) {
                mode = RefreshMode.ASYNC;
            }
        }
    }

    public record Files(@NotBlank String root) {

        public Files {
            if (root == null || root.isBlank()) {
                root = "./data/files";
            }
        }
    }

    public record PagingLimits(int maxPageSize) {

        public PagingLimits {
            if (maxPageSize <= 0) {
                maxPageSize = 100;
            }
        }
    }
}
