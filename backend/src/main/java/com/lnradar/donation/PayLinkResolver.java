package com.lnradar.donation;

import com.lnradar.config.CaffeineConfig;
import com.lnradar.domain.PayLink;
import com.lnradar.ingestion.adapter.WalletApiClient;
import com.lnradar.ingestion.wallet.WalletRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Resolves a pay-link id against the main wallet's link listing. Cached briefly: the donations page is polled
 * by browsers and the link rarely changes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PayLinkResolver {

    private final WalletApiClient client;
    private final WalletRegistry walletRegistry;

    @Cacheable(cacheNames = CaffeineConfig.PAY_LINK_CACHE, unless = "#result == null")
    public Optional<PayLink> resolve(String linkId) {
        if (linkId == null || linkId.isBlank()) {
            return Optional.empty();
        }
        List<PayLink> links;
        try {
            links = client.fetchPayLinks(walletRegistry.main().credential());
        } catch (RuntimeException e) {
            log.warn("Cannot list pay links: {}", e.getMessage());
            return Optional.empty();
        }
        Optional<PayLink> found = links.stream().filter(l -> linkId.equals(l.id())).findFirst();
        if (found.isEmpty()) {
            log.error("No pay link found with id {}", linkId);
        }
        return found;
    }
}
