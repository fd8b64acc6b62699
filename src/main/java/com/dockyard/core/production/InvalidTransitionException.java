package com.dockyard.core.production;

public class InvalidTransitionException extends RuntimeException {

    private final ProductionStatus from;
    private final ProductionStatus to;

    public InvalidTransitionException(String projectId, ProductionStatus from, ProductionStatus to) {
        super("Project " + projectId + ": production cannot move from " + from.value() + " to " + to.value());
        this.from = from;
        this.to = to;
    }

    public InvalidTransitionException(String message) {
        super(message);
        this.from = null;
        this.to = null;
    }

    public ProductionStatus getFrom() { return from; }
    public ProductionStatus getTo() { return to; }
}
