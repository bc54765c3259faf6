package com.lnradar.ingestion.sync.balance;

import com.lnradar.domain.BalanceEvent;
import com.lnradar.ingestion.config.PollingProperties;
import com.lnradar.ingestion.config.PollingProperties.SnapshotAdvance;
import com.lnradar.ingestion.store.BalanceSnapshotStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Compares a freshly fetched balance with the wallet's snapshot. First observation stores the balance and yields
 * {@link BalanceEvent.Type#INITIAL_BALANCE_SET} without any threshold comparison. Afterwards a
 * {@link BalanceEvent.Type#BALANCE_CHANGED} is yielded when the balance moved and {@code |current - previous| >= threshold}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BalanceChangeDetector {

    private final BalanceSnapshotStore snapshotStore;
    private final PollingProperties properties;

    public Optional<BalanceEvent> detect(String walletTag, long current) {
        Optional<Long> previous = snapshotStore.load(walletTag);
        if (previous.isEmpty()) {
            snapshotStore.save(walletTag, current);
            log.info("Initial balance for {} set to {}", walletTag, current);
            return Optional.of(BalanceEvent.initial(walletTag, current));
        }

        long last = previous.get();
        long delta = current - last;
        if (delta == 0) {
            log.debug("Balance for {} unchanged at {}", walletTag, current);
            return Optional.empty();
        }
        long threshold = properties.getBalanceChangeThreshold();
        if (Math.abs(delta) < threshold) {
            log.info("Balance change for {} ({}) below threshold ({})", walletTag, delta, threshold);
            if (properties.getSnapshotAdvance() == SnapshotAdvance.ALWAYS) {
                snapshotStore.save(walletTag, current);
            }
            return Optional.empty();
        }

        snapshotStore.save(walletTag, current);
        log.info("Balance for {} changed from {} to {} ({}{})", walletTag, last, current, delta > 0 ? "+" : "", delta);
        return Optional.of(BalanceEvent.changed(walletTag, last, current));
    }
}
