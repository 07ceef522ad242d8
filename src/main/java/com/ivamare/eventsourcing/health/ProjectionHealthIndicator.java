package com.ivamare.eventsourcing.health;

import com.ivamare.eventsourcing.projection.ProjectionRunner;
import com.ivamare.eventsourcing.projection.ProjectionState;
import com.ivamare.eventsourcing.projection.ProjectionStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for projections.
 *
 * <p>UNKNOWN without projections, DOWN when any projection is in error, UP otherwise.
 */
public class ProjectionHealthIndicator implements HealthIndicator {

    private final ProjectionRunner projectionRunner;

    public ProjectionHealthIndicator(ProjectionRunner projectionRunner) {
        this.projectionRunner = projectionRunner;
    }

    @Override
    public Health health() {
        List<ProjectionStatus> statuses = projectionRunner.getStatuses();
        if (statuses.isEmpty()) {
            return Health.unknown()
                .withDetail("message", "No projections registered")
                .build();
        }

        Map<String, ProjectionDetail> details = new LinkedHashMap<>();
        long maxLag = 0;
        for (ProjectionStatus status : statuses) {
            details.put(status.name(), new ProjectionDetail(status.state(), status.lastProcessedPosition(),
                status.lag(), status.eventsProcessed(), status.errorMessage()));
            maxLag = Math.max(maxLag, status.lag());
        }

        boolean anyError = statuses.stream().anyMatch(s -> s.state() == ProjectionState.ERROR);
        Health.Builder builder = anyError ? Health.down() : Health.up();

        return builder
            .withDetail("running", projectionRunner.isRunning())
            .withDetail("projections", details)
            .withDetail("maxLag", maxLag)
            .build();
    }

    record ProjectionDetail(ProjectionState state, long position, long lag, long eventsProcessed,
                            String errorMessage) {}
}
