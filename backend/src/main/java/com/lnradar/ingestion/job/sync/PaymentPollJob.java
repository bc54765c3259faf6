package com.lnradar.ingestion.job.sync;

import com.lnradar.ingestion.config.PollingProperties;
import com.lnradar.ingestion.sync.WalletPollAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic poll tick: balance and recent payments for every configured wallet.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentPollJob {

    private final WalletPollAggregator walletPollAggregator;
    private final PollingProperties pollingProperties;

    @Scheduled(
            fixedRateString = "${lnradar.polling.interval-ms:60000}",
            initialDelayString = "${lnradar.polling.initial-delay-ms:1000}")
    public void runScheduled() {
        if (!pollingProperties.isEnabled()) {
            log.debug("Payment polling disabled");
            return;
        }
        walletPollAggregator.pollAll();
    }
}
