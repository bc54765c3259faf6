package com.lnradar.ingestion.job.digest;

import com.lnradar.ingestion.config.DigestProperties;
import com.lnradar.ingestion.sync.digest.WalletDigestService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic wallet digest, scheduled independently of the poll tick (daily by default).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WalletDigestJob {

    private final WalletDigestService walletDigestService;
    private final DigestProperties digestProperties;

    @Scheduled(
            fixedRateString = "${lnradar.digest.interval-ms:86400000}",
            initialDelayString = "${lnradar.digest.initial-delay-ms:5000}")
    public void runScheduled() {
        if (!digestProperties.isEnabled()) {
            log.debug("Wallet digest disabled");
            return;
        }
        log.info("Building wallet digest");
        walletDigestService.publishDigest();
    }
}
