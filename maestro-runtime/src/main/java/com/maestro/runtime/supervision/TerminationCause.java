package com.maestro.runtime.supervision;

/**
 * Why a worker terminated: a requested stop, or death after the restart budget ran out.
 *
 * @param kind    STOPPED or FAILED
 * @param failure last failure for FAILED; null for STOPPED
 */
public record TerminationCause(Kind kind, Throwable failure) {

    public enum Kind {
        STOPPED,
        FAILED
    }

    public static TerminationCause stopped() {
        return new TerminationCause(Kind.STOPPED, null);
    }

    public static TerminationCause failed(Throwable failure) {
        return new TerminationCause(Kind.FAILED, failure);
    }

    public boolean isFailure() {
        return kind == Kind.FAILED;
    }
}
