package com.flagship.invoice_followup.followup;

public enum FailureKind {
    /** Provider hiccup. Retried after backoff, up to the attempt limit. */
    TRANSIENT,
    /** Recipient-side rejection. Terminal. */
    PERMANENT,
    /** Bad invoice or template data, e.g. no contact address. Terminal until fixed and re-sent manually. */
    VALIDATION
}
