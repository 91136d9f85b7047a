package com.supersoft.photonest.media_import_processor.exception;

public class IllegalStateTransitionException extends RuntimeException {

    private final String fromState;
    private final String toState;

    public IllegalStateTransitionException(Enum<?> from, Enum<?> to) {
        super(String.format("Invalid transition from %s to %s", from, to));
        this.fromState = from.name();
        this.toState = to.name();
    }

    public String getFromState() {
        return fromState;
    }

    public String getToState() {
        return toState;
    }
}
