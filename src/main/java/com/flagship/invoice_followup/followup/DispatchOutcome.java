package com.flagship.invoice_followup.followup;

/**
 * Result of one dispatch attempt, as seen by the worker.
 */
public enum DispatchOutcome {
    SENT,
    FAILED_TRANSIENT,
    FAILED_PERMANENT,
    FAILED_VALIDATION,
    /** Another worker owns this attempt. Not an error. */
    CLAIM_CONFLICT,
    /** The claim went stale and was taken over before the outcome could be written. */
    SUPERSEDED,
    /** The outcome could not be recorded; the row stays PENDING until the stale-claim timeout. */
    ERROR;

    public static DispatchOutcome forFailure(FailureKind kind) {
        return switch (kind) {
            case TRANSIENT -> FAILED_TRANSIENT;
            case PERMANENT -> FAILED_PERMANENT;
            case VALIDATION -> FAILED_VALIDATION;
        };
    }
}
