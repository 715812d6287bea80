package com.cypher.guard.error;

/**
 * Runtime exception thrown when the graph database fails or does not answer in time.
 */
public class EngineException extends QueryGuardException {

    private final String code;
    private final boolean timeout;

    public EngineException(String message, Throwable cause) {
        this(message, null, false, cause);
    }

    public EngineException(String message, String code, boolean timeout, Throwable cause) {
        super(ErrorKind.ENGINE, message, cause);
        this.code = code;
        this.timeout = timeout;
    }

    public static EngineException timeout(long timeoutSeconds, Throwable cause) {
        return new EngineException("Query execution timeout after " + timeoutSeconds + " seconds",
                null, true, cause);
    }

    /**
     * Database status code, e.g. {@code Neo.ClientError.Statement.SyntaxError}, when known.
     */
    public String code() {
        return code;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
