package com.di.poolguard.exception;

/**
 * Fast-fail rejection: the circuit breaker is open and the operation was not attempted.
 *
 * <p>Mapped to 503 by {@link GlobalExceptionHandler}. Callers should back off on their own.
 */
public class CircuitOpenException extends PoolAccessException {

    private final String operationName;

    public CircuitOpenException(String operationName) {
        super("Circuit breaker is open - operation '" + operationName + "' rejected without an attempt");
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }
}
