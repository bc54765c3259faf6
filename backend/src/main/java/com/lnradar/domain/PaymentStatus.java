package com.lnradar.domain;

import java.util.Locale;

/**
 * Upstream payment status. Anything other than "pending" is treated as completed.
 */
public enum PaymentStatus {
    COMPLETED,
    PENDING;

    public static PaymentStatus fromUpstream(String value) {
        if (value != null && "pending".equals(value.strip().toLowerCase(Locale.ROOT))) {
            return PENDING;
        }
        return COMPLETED;
    }
}
