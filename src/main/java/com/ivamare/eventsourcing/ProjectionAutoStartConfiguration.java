package com.ivamare.eventsourcing;

import com.ivamare.eventsourcing.projection.ProjectionRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import jakarta.annotation.PreDestroy;

/**
 * Auto-start configuration for the projection runner.
 *
 * <p>Enable with:
 * <pre>
 * eventsourcing:
 *   projection:
 *     auto-start: true
 * </pre>
 */
@Configuration
@ConditionalOnProperty(prefix = "eventsourcing.projection", name = "auto-start", havingValue = "true")
public class ProjectionAutoStartConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ProjectionAutoStartConfiguration.class);

    private final ProjectionRunner projectionRunner;

    public ProjectionAutoStartConfiguration(ProjectionRunner projectionRunner) {
        this.projectionRunner = projectionRunner;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startProjections() {
        if (projectionRunner.projectionNames().isEmpty()) {
            log.warn("No projections registered, runner started idle");
        }
        projectionRunner.start();
        log.info("Started projection runner with {} projections", projectionRunner.projectionNames().size());
    }

    @PreDestroy
    public void stopProjections() {
        if (!projectionRunner.isRunning()) {
            return;
        }
        log.info("Stopping projection runner...");
        projectionRunner.stop();
        log.info("Projection runner stopped");
    }
}
