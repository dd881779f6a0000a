package com.di.poolguard.exception;

/**
 * Terminal failure of an operation after all retry attempts were used up.
 * The last underlying failure is always available as {@link #getCause()}.
 */
public class OperationFailedException extends PoolAccessException {

    private final String operationName;
    private final int attempts;

    public OperationFailedException(String operationName, int attempts, Throwable cause) {
        super("Operation '" + operationName + "' failed after " + attempts + " attempt(s): "
                + (cause != null && cause.getMessage() != null ? cause.getMessage() : describe(cause)), cause);
        this.operationName = operationName;
        this.attempts = attempts;
    }

    public String getOperationName() {
        return operationName;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(Throwable cause) {
        return cause != null ? cause.getClass().getSimpleName() : "unknown cause";
    }
}
