package com.cypher.guard.error;

/**
 * Root of the exceptions raised below the service boundary.
 */
public class QueryGuardException extends RuntimeException {

    private final ErrorKind kind;

    public QueryGuardException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public QueryGuardException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
