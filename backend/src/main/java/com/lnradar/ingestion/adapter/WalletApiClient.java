package com.lnradar.ingestion.adapter;

import com.lnradar.domain.PayLink;
import com.lnradar.domain.PaymentRecord;

import java.util.List;

/**
 * Read-only wallet API, keyed by a per-wallet credential. Every method blocks for at most the configured
 * timeout and throws {@link UpstreamException} on any failure.
 */
public interface WalletApiClient {

    /**
     * Current balance in milli-units.
     */
    long fetchBalanceMsat(String credential);

    /**
     * Recent payments as returned by the upstream, at most {@code limit} of them when the upstream honours the
     * limit. Callers still sort and trim.
     */
    List<PaymentRecord> fetchRecentPayments(String credential, int limit);

    /**
     * Pay-links visible to the credential.
     */
    List<PayLink> fetchPayLinks(String credential);
}
