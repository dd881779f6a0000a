package com.di.poolguard.exception;

/**
 * The operation was abandoned because the executor shut down (or the calling thread was
 * interrupted) before it could finish its retries.
 */
public class OperationAbortedException extends PoolAccessException {

    private final String operationName;

    public OperationAbortedException(String operationName, String reason) {
        super("Operation '" + operationName + "' aborted: " + reason);
        this.operationName = operationName;
    }

    public OperationAbortedException(String operationName, String reason, Throwable cause) {
        super("Operation '" + operationName + "' aborted: " + reason, cause);
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }
}
