package com.lnradar.ingestion.classifier;

/**
 * Why a raw payment did not become a classified event.
 */
public enum SkipReason {
    /** Not yet settled; re-examined on later ticks. */
    PENDING,
    /** Signed amount of exactly zero; not an economic event. */
    ZERO_AMOUNT,
    /** No identifier; can never be deduplicated. */
    MISSING_IDENTIFIER,
    /** Amount absent or not numeric. */
    MALFORMED_AMOUNT
}
