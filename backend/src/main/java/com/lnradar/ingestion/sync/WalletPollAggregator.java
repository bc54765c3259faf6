package com.lnradar.ingestion.sync;

import com.lnradar.domain.TickCompletedEvent;
import com.lnradar.domain.WalletDescriptor;
import com.lnradar.domain.WalletTickResult;
import com.lnradar.ingestion.sync.progress.WalletStatusTracker;
import com.lnradar.ingestion.wallet.WalletRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one tick across all configured wallets, sequentially. A failure in one wallet never stops the others;
 * identifiers are namespaced per wallet so iteration order does not affect persisted totals. Overlapping ticks
 * are skipped rather than queued.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WalletPollAggregator {

    private final WalletRegistry walletRegistry;
    private final WalletPoller walletPoller;
    private final WalletStatusTracker statusTracker;
    private final ApplicationEventPublisher eventPublisher;
    private final ReentrantLock tickLock = new ReentrantLock();

    public List<WalletTickResult> pollAll() {
        if (!tickLock.tryLock()) {
            log.warn("Previous poll tick still running; skipping this one");
            return List.of();
        }
        try {
            List<WalletTickResult> results = new ArrayList<>();
            for (WalletDescriptor wallet : walletRegistry.all()) {
                WalletTickResult result;
                try {
                    result = walletPoller.poll(wallet);
                } catch (RuntimeException e) {
                    log.error("Unexpected failure polling wallet {}", wallet.tag(), e);
                    result = WalletTickResult.failed(wallet);
                }
                statusTracker.onTick(result);
                results.add(result);
            }
            eventPublisher.publishEvent(new TickCompletedEvent(List.copyOf(results)));
            return results;
        } finally {
            tickLock.unlock();
        }
    }
}
