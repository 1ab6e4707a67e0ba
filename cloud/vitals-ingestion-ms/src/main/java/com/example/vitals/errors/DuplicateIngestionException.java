package com.example.vitals.errors;

/**
 * Raised when the idempotency ledger loses an insert race for a key another
 * transaction recorded concurrently. The enclosing unit of work must be
 * rolled back and the request reported as a duplicate.
 */
public class DuplicateIngestionException extends RuntimeException {

    private final String idemKey;

    public DuplicateIngestionException(String idemKey, Throwable cause) {
        super("Idempotency key already recorded: " + idemKey, cause);
        this.idemKey = idemKey;
    }

    public String getIdemKey() {
        return idemKey;
    }
}
