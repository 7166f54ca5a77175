package org.teamelites.swarm.spi;

/**
 * Failure of a call into an external collaborator (hub, reasoning gateway, provisioner,
 * agent execution service).
 * <p>
 * Thrown out of the single step that issued the call. Callers decide the blast radius: the
 * evolution engine aborts only the current candidate, the reasoning bridge swallows it.
 */
public class CollaboratorException extends Exception {

    private final String operation;

    public CollaboratorException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public CollaboratorException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    /**
     * @return the collaborator operation that failed, e.g. {@code claim_problem}.
     */
    public String getOperation() {
        return operation;
    }
}
