package com.ivamare.eventsourcing.replay;

import java.time.Instant;
import java.util.List;

/**
 * Filter and pacing options of a replay session.
 *
 * @param from                  inclusive lower timestamp bound
 * @param to                    inclusive upper timestamp bound
 * @param eventTypes            accepted event types, empty for all
 * @param aggregateTypes        accepted aggregate types, empty for all
 * @param aggregateIds          accepted aggregate ids, empty for all
 * @param speed                 pacing multiplier: 1 replays at original pace, higher is faster;
 *                              null or non-positive disables pacing
 * @param batchSize             events per batch, null for the configured default
 * @param pauseBetweenBatchesMs pause after each batch, null for the configured default
 * @param dryRun                process without dispatching
 */
public record ReplayOptions(
    Instant from,
    Instant to,
    List<String> eventTypes,
    List<String> aggregateTypes,
    List<String> aggregateIds,
    Double speed,
    Integer batchSize,
    Long pauseBetweenBatchesMs,
    boolean dryRun
) {

    public ReplayOptions {
        eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
        aggregateTypes = aggregateTypes == null ? List.of() : List.copyOf(aggregateTypes);
        aggregateIds = aggregateIds == null ? List.of() : List.copyOf(aggregateIds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean paced() {
        return speed != null && speed > 0;
    }

    public static final class Builder {

        private Instant from;
        private Instant to;
        private List<String> eventTypes;
        private List<String> aggregateTypes;
        private List<String> aggregateIds;
        private Double speed;
        private Integer batchSize;
        private Long pauseBetweenBatchesMs;
        private boolean dryRun;

        private Builder() {
        }

        public Builder from(Instant from) {
            this.from = from;
            return this;
        }

        public Builder to(Instant to) {
            this.to = to;
            return this;
        }

        public Builder eventTypes(List<String> eventTypes) {
            this.eventTypes = eventTypes;
            return this;
        }

        public Builder aggregateTypes(List<String> aggregateTypes) {
            this.aggregateTypes = aggregateTypes;
            return this;
        }

        public Builder aggregateIds(List<String> aggregateIds) {
            this.aggregateIds = aggregateIds;
            return this;
        }

        public Builder speed(Double speed) {
            this.speed = speed;
            return this;
        }

        public Builder batchSize(Integer batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder pauseBetweenBatchesMs(Long pauseBetweenBatchesMs) {
            this.pauseBetweenBatchesMs = pauseBetweenBatchesMs;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public ReplayOptions build() {
            return new ReplayOptions(from, to, eventTypes, aggregateTypes, aggregateIds,
                speed, batchSize, pauseBetweenBatchesMs, dryRun);
        }
    }
}
