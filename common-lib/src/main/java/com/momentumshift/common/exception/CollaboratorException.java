package com.momentumshift.common.exception;

/**
 * Wraps a failure of an injected external collaborator (player-history store,
 * sentiment source, ground-truth source) so it surfaces as a typed error
 * instead of a raw transport exception.
 */
public class CollaboratorException extends MssException {

    private final String collaborator;

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(collaborator, message, cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
