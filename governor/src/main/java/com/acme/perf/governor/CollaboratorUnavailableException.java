package com.acme.perf.governor;

public final class CollaboratorUnavailableException extends RuntimeException {
    private final String collaborator;

    public CollaboratorUnavailableException(String collaborator, Throwable cause) {
        super("Collaborator unavailable: " + collaborator
            + (cause == null ? "" : " (" + cause.getClass().getSimpleName() + ")"), cause);
        this.collaborator = collaborator;
    }

    public String collaborator() {
        return collaborator;
    }
}
