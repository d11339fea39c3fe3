package io.syncbeat.mirror;

/**
 * A reconciliation pass failed and its transaction was rolled back.
 */
public class ReconciliationException extends RuntimeException {

    private final String kind;

    public ReconciliationException(String kind, Throwable cause) {
        super("Reconciliation of " + kind + " failed: " + cause.getMessage(), cause);
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }
}
