package com.cypher.guard.error;

/**
 * Thrown when a query that would modify data is about to be executed, e.g. profiled,
 * without write permission.
 */
public class WriteBlockedException extends QueryGuardException {

    private final String operation;

    public WriteBlockedException(String operation) {
        super(ErrorKind.WRITE_BLOCKED, "Write operation " + operation
                + " cannot be profiled: PROFILE executes the query. Use EXPLAIN or allow write queries.");
        this.operation = operation;
    }

    /**
     * The detected write keyword, e.g. {@code CREATE}.
     */
    public String operation() {
        return operation;
    }
}
