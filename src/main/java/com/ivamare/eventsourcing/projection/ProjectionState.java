package com.ivamare.eventsourcing.projection;

public enum ProjectionState {
    RUNNING,
    PAUSED,
    REBUILDING,
    ERROR
}
