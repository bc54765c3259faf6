package com.lnradar.ingestion.sync.digest;

import com.lnradar.common.DisplayUnits;
import com.lnradar.domain.DigestReadyEvent;
import com.lnradar.domain.PaymentRecord;
import com.lnradar.domain.PaymentStatus;
import com.lnradar.domain.WalletDescriptor;
import com.lnradar.domain.WalletDigest;
import com.lnradar.ingestion.adapter.WalletApiClient;
import com.lnradar.ingestion.config.PollingProperties;
import com.lnradar.ingestion.wallet.WalletRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds the periodic per-wallet digest straight from the upstream. Read-only: it never touches the identifier
 * ledger or the balance snapshots, so it cannot disturb tick-to-tick deltas.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletDigestService {

    private final WalletRegistry walletRegistry;
    private final WalletApiClient client;
    private final PollingProperties pollingProperties;
    private final ApplicationEventPublisher eventPublisher;

    public List<WalletDigest> publishDigest() {
        List<WalletDigest> digests = new ArrayList<>();
        for (WalletDescriptor wallet : walletRegistry.all()) {
            digestOf(wallet).ifPresent(digests::add);
        }
        if (!digests.isEmpty()) {
            eventPublisher.publishEvent(new DigestReadyEvent(List.copyOf(digests)));
        }
        return digests;
    }

    Optional<WalletDigest> digestOf(WalletDescriptor wallet) {
        long balanceMsat;
        List<PaymentRecord> payments;
        try {
            balanceMsat = client.fetchBalanceMsat(wallet.credential());
            payments = client.fetchRecentPayments(wallet.credential(), pollingProperties.getRecentPaymentsCount());
        } catch (RuntimeException e) {
            log.warn("Digest for wallet {} skipped: {}", wallet.tag(), e.getMessage());
            return Optional.empty();
        }
        int inCount = 0;
        int outCount = 0;
        long inTotal = 0;
        long outTotal = 0;
        for (PaymentRecord p : payments) {
            if (p.status() == PaymentStatus.PENDING || p.amountMsat() == null) {
                continue;
            }
            if (p.amountMsat() > 0) {
                inCount++;
                inTotal += DisplayUnits.magnitudeOf(p.amountMsat());
            } else if (p.amountMsat() < 0) {
                outCount++;
                outTotal += DisplayUnits.magnitudeOf(p.amountMsat());
            }
        }
        return Optional.of(new WalletDigest(wallet, DisplayUnits.toWholeUnits(balanceMsat),
                inCount, inTotal, outCount, outTotal));
    }
}
