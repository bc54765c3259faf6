package com.lnradar.ingestion.filter;

import com.lnradar.config.AsyncConfig;
import com.lnradar.ingestion.store.DonationLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Re-applies the current forbidden-word set to every memo already stored in the donation ledger.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MemoResanitizer {

    private final DonationLedger donationLedger;
    private final MemoSanitizer memoSanitizer;

    @Async(AsyncConfig.MAINTENANCE_EXECUTOR)
    public void resanitizeAsync() {
        resanitize();
    }

    public int resanitize() {
        int changed = donationLedger.resanitize(memoSanitizer::sanitize);
        log.info("Re-sanitized stored donation memos: {} changed", changed);
        return changed;
    }
}
