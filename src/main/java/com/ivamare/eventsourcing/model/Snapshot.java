package com.ivamare.eventsourcing.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Materialized aggregate state captured at a known version.
 *
 * @param aggregateId   aggregate id
 * @param aggregateType aggregate type name
 * @param version       aggregate version at capture time
 * @param state         exported state
 * @param timestamp     capture time
 */
public record Snapshot(
    String aggregateId,
    String aggregateType,
    long version,
    Map<String, Object> state,
    Instant timestamp
) {

    public Snapshot {
        state = state == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }
}
