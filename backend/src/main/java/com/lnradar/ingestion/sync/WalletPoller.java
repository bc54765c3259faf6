package com.lnradar.ingestion.sync;

import com.lnradar.common.DisplayUnits;
import com.lnradar.domain.BalanceEvent;
import com.lnradar.domain.ClassifiedEvent;
import com.lnradar.domain.Donation;
import com.lnradar.domain.EventIdentifier;
import com.lnradar.domain.PaymentRecord;
import com.lnradar.domain.WalletDescriptor;
import com.lnradar.domain.WalletTickResult;
import com.lnradar.ingestion.adapter.WalletApiClient;
import com.lnradar.ingestion.classifier.Classification;
import com.lnradar.ingestion.classifier.PaymentClassifier;
import com.lnradar.ingestion.classifier.SkipReason;
import com.lnradar.ingestion.store.DonationLedger;
import com.lnradar.ingestion.store.IdentifierLedger;
import com.lnradar.ingestion.sync.balance.BalanceChangeDetector;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One tick for one wallet: IDLE, FETCHING (balance + recent payments), DIFFING (balance snapshot, identifier
 * ledger, classification, donations), DONE. Both fetches complete before any state is committed, so a failed
 * fetch leaves every store untouched and the wallet is simply retried on the next tick.
 */
@Slf4j
public class WalletPoller {

    private final WalletApiClient client;
    private final IdentifierLedger identifierLedger;
    private final DonationLedger donationLedger;
    private final BalanceChangeDetector balanceChangeDetector;
    private final PaymentClassifier classifier;
    private final int recentPaymentsCount;
    private final String donationLinkId;
    private final Clock clock;
    private final Map<String, PollState> states = new ConcurrentHashMap<>();

    public WalletPoller(WalletApiClient client,
                        IdentifierLedger identifierLedger,
                        DonationLedger donationLedger,
                        BalanceChangeDetector balanceChangeDetector,
                        PaymentClassifier classifier,
                        int recentPaymentsCount,
                        String donationLinkId,
                        Clock clock) {
        this.client = client;
        this.identifierLedger = identifierLedger;
        this.donationLedger = donationLedger;
        this.balanceChangeDetector = balanceChangeDetector;
        this.classifier = classifier;
        this.recentPaymentsCount = recentPaymentsCount;
        this.donationLinkId = donationLinkId;
        this.clock = clock;
    }

    public WalletTickResult poll(WalletDescriptor wallet) {
        transition(wallet, PollState.FETCHING);
        long balanceMsat;
        List<PaymentRecord> payments;
        try {
            balanceMsat = client.fetchBalanceMsat(wallet.credential());
            payments = client.fetchRecentPayments(wallet.credential(), recentPaymentsCount);
        } catch (RuntimeException e) {
            log.warn("Poll for wallet {} abandoned this tick: {}", wallet.tag(), e.getMessage());
            transition(wallet, PollState.IDLE);
            return WalletTickResult.failed(wallet);
        }

        transition(wallet, PollState.DIFFING);
        long balance = DisplayUnits.toWholeUnits(balanceMsat);
        Optional<BalanceEvent> balanceEvent = balanceChangeDetector.detect(wallet.tag(), balance);
        List<ClassifiedEvent> events = diffPayments(wallet, payments);

        transition(wallet, PollState.DONE);
        log.info("Poll for wallet {} done: {} new payment(s), balance event: {}",
                wallet.tag(), events.size(), balanceEvent.map(e -> e.type().name()).orElse("none"));
        transition(wallet, PollState.IDLE);
        return WalletTickResult.completed(wallet, balance, balanceEvent, events);
    }

    public PollState stateOf(String walletTag) {
        return states.getOrDefault(walletTag, PollState.IDLE);
    }

    private List<ClassifiedEvent> diffPayments(WalletDescriptor wallet, List<PaymentRecord> payments) {
        List<PaymentRecord> latest = payments.stream()
                .sorted(Comparator.comparing((PaymentRecord p) -> p.createdAt().instant()).reversed())
                .limit(recentPaymentsCount)
                .toList();

        List<ClassifiedEvent> out = new ArrayList<>();
        for (PaymentRecord payment : latest) {
            if (payment.hasIdentifier()
                    && identifierLedger.has(new EventIdentifier(wallet.tag(), payment.paymentHash()))) {
                continue;
            }
            Classification classification = classifier.classify(payment, wallet.tag(), donationLinkId);
            if (classification.skipReason() == SkipReason.PENDING
                    || classification.skipReason() == SkipReason.MISSING_IDENTIFIER) {
                continue;
            }
            // record before routing: a crash in between drops a donation rather than counting it twice
            EventIdentifier id = new EventIdentifier(wallet.tag(), payment.paymentHash());
            if (!identifierLedger.record(id)) {
                continue;
            }
            classification.asEvent().ifPresent(event -> {
                if (event.donation()) {
                    accumulateDonation(event);
                }
                out.add(event);
            });
        }
        return out;
    }

    private void accumulateDonation(ClassifiedEvent event) {
        Donation donation = new Donation(
                UUID.randomUUID().toString(),
                event.timestamp().isParsed() ? event.timestamp().instant() : clock.instant(),
                event.donationComment(),
                event.donationAmount());
        donationLedger.append(donation);
    }

    private void transition(WalletDescriptor wallet, PollState next) {
        states.put(wallet.tag(), next);
        log.debug("Wallet {} -> {}", wallet.tag(), next);
    }
}
