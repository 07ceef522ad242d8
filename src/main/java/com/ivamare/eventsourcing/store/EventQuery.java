package com.ivamare.eventsourcing.store;

import com.ivamare.eventsourcing.model.DomainEvent;

import java.time.Instant;
import java.util.List;

/**
 * Filter for global event reads.
 *
 * <p>All criteria are optional and combined with AND. When {@code afterPosition} is set
 * results are ordered by global position, otherwise by timestamp with position as the
 * tie-breaker.
 *
 * @param from            inclusive lower timestamp bound
 * @param to              inclusive upper timestamp bound
 * @param eventTypes      accepted event types, empty for all
 * @param aggregateType   accepted aggregate type
 * @param aggregateIds    accepted aggregate ids, empty for all
 * @param afterPosition   only events with a greater global position
 * @param excludeArchived skip archived events
 * @param limit           maximum number of events
 * @param offset          number of matching events to skip
 */
public record EventQuery(
    Instant from,
    Instant to,
    List<String> eventTypes,
    String aggregateType,
    List<String> aggregateIds,
    Long afterPosition,
    boolean excludeArchived,
    Integer limit,
    Integer offset
) {

    public EventQuery {
        eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
        aggregateIds = aggregateIds == null ? List.of() : List.copyOf(aggregateIds);
    }

    public static EventQuery all() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean orderedByPosition() {
        return afterPosition != null;
    }

    /**
     * Check the non-paging criteria against an event. Archival is checked by the store.
     */
    public boolean matches(DomainEvent event) {
        if (from != null && event.timestamp().isBefore(from)) {
            return false;
        }
        if (to != null && event.timestamp().isAfter(to)) {
            return false;
        }
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.eventType())) {
            return false;
        }
        if (aggregateType != null && !aggregateType.equals(event.aggregateType())) {
            return false;
        }
        if (!aggregateIds.isEmpty() && !aggregateIds.contains(event.aggregateId())) {
            return false;
        }
        return afterPosition == null || event.position() > afterPosition;
    }

    public Builder toBuilder() {
        return new Builder()
            .from(from)
            .to(to)
            .eventTypes(eventTypes)
            .aggregateType(aggregateType)
            .aggregateIds(aggregateIds)
            .afterPosition(afterPosition)
            .excludeArchived(excludeArchived)
            .limit(limit)
            .offset(offset);
    }

    public static final class Builder {

        private Instant from;
        private Instant to;
        private List<String> eventTypes = List.of();
        private String aggregateType;
        private List<String> aggregateIds = List.of();
        private Long afterPosition;
        private boolean excludeArchived;
        private Integer limit;
        private Integer offset;

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

        public Builder eventType(String eventType) {
            this.eventTypes = List.of(eventType);
            return this;
        }

        public Builder aggregateType(String aggregateType) {
            this.aggregateType = aggregateType;
            return this;
        }

        public Builder aggregateIds(List<String> aggregateIds) {
            this.aggregateIds = aggregateIds;
            return this;
        }

        public Builder aggregateId(String aggregateId) {
            this.aggregateIds = List.of(aggregateId);
            return this;
        }

        public Builder afterPosition(Long afterPosition) {
            this.afterPosition = afterPosition;
            return this;
        }

        public Builder excludeArchived(boolean excludeArchived) {
            this.excludeArchived = excludeArchived;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public EventQuery build() {
            return new EventQuery(from, to, eventTypes, aggregateType, aggregateIds,
                afterPosition, excludeArchived, limit, offset);
        }
    }
}
