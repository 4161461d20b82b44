package com.armada.core.error;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Typed failure raised by every core component. The {@link ErrorKind} is stable
 * and intended for callers that branch on the failure; the message is for humans.
 */
public class ArmadaException extends RuntimeException {

    private final ErrorKind kind;

    public ArmadaException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ArmadaException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String code() {
        return kind.code();
    }

    public boolean is(ErrorKind candidate) {
        return kind == candidate;
    }

    @Override
    public String toString() {
        return "ArmadaException[" + kind.code() + "]: " + getMessage();
    }

    public static ArmadaException notFound(String what, String id) {
        return new ArmadaException(ErrorKind.NOT_FOUND, what + " not found: " + id);
    }

    public static ArmadaException cancelled(String message) {
        return new ArmadaException(ErrorKind.CANCELLED, message);
    }

    /**
     * Unwraps async wrappers and converts anything that is not already typed into
     * {@link ErrorKind#EXECUTION_FAILED}.
     */
    public static ArmadaException wrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ArmadaException typed) {
            return typed;
        }
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ArmadaException(ErrorKind.EXECUTION_FAILED, message, cause);
    }
}
