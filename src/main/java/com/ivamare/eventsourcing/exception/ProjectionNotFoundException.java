package com.ivamare.eventsourcing.exception;

/**
 * Thrown when a projection name is not registered with the runner.
 */
public class ProjectionNotFoundException extends EventSourcingException {

    private final String projectionName;

    public ProjectionNotFoundException(String projectionName) {
        super("Projection " + projectionName + " not found");
        this.projectionName = projectionName;
    }

    public String getProjectionName() {
        return projectionName;
    }
}
