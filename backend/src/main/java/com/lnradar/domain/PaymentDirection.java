package com.lnradar.domain;

/**
 * Direction of a committed payment, derived from the sign of the raw milli-unit amount.
 */
public enum PaymentDirection {
    INCOMING,
    OUTGOING
}
