package com.ivamare.eventsourcing.replay;

public enum ReplayStatus {
    RUNNING,
    PAUSED,
    COMPLETED,
    ERROR
}
