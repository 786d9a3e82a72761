package org.ltlf.solver;

/**
 * Fallimento nell'uso del verificatore esterno.
 */
public class ExternalToolException extends Exception {

    public enum Reason {
        MISSING_EXECUTABLE,
        NONZERO_EXIT,
        UNPARSEABLE_OUTPUT,
        TIMEOUT,
        INTERRUPTED,
        IO_FAILURE
    }

    private final Reason reason;

    public ExternalToolException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExternalToolException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
