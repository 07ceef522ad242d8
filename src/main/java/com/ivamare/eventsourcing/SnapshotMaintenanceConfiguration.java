package com.ivamare.eventsourcing;

import com.ivamare.eventsourcing.snapshot.SnapshotManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Scheduled snapshot maintenance.
 *
 * <p>Enable with:
 * <pre>
 * eventsourcing:
 *   snapshot:
 *     maintenance-enabled: true
 *     maintenance-cron: "0 0 3 * * *"
 * </pre>
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "eventsourcing.snapshot", name = "maintenance-enabled", havingValue = "true")
public class SnapshotMaintenanceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SnapshotMaintenanceConfiguration.class);

    private final SnapshotManager snapshotManager;

    public SnapshotMaintenanceConfiguration(SnapshotManager snapshotManager) {
        this.snapshotManager = snapshotManager;
    }

    @Scheduled(cron = "${eventsourcing.snapshot.maintenance-cron:0 0 3 * * *}")
    public void maintainSnapshots() {
        int refreshed = snapshotManager.maintainSnapshots();
        log.debug("Scheduled snapshot maintenance refreshed {} snapshots", refreshed);
    }
}
