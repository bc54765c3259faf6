package com.lnradar.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lnradar.common.TimestampNormalizer;
import com.lnradar.ingestion.adapter.PaymentRecordDecoder;
import com.lnradar.ingestion.adapter.WalletApiClient;
import com.lnradar.ingestion.adapter.WebClientWalletApiClient;
import com.lnradar.ingestion.classifier.PaymentClassifier;
import com.lnradar.ingestion.store.BalanceSnapshotStore;
import com.lnradar.ingestion.store.DonationLedger;
import com.lnradar.ingestion.store.IdentifierLedger;
import com.lnradar.ingestion.sync.WalletPoller;
import com.lnradar.ingestion.sync.balance.BalanceChangeDetector;
import com.lnradar.ingestion.wallet.WalletRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the wallet API adapter, the three file-backed stores and the per-wallet poller.
 */
@Configuration
@EnableConfigurationProperties({ UpstreamProperties.class, WalletProperties.class, PollingProperties.class, DigestProperties.class, DonationProperties.class, StorageProperties.class, SanitizerProperties.class })
public class IngestionConfig {

    @Bean
    public TimestampNormalizer timestampNormalizer(Clock clock) {
        return new TimestampNormalizer(clock);
    }

    @Bean
    public PaymentRecordDecoder paymentRecordDecoder(TimestampNormalizer timestampNormalizer) {
        return new PaymentRecordDecoder(timestampNormalizer);
    }

    @Bean
    public WalletApiClient walletApiClient(WebClient.Builder webClientBuilder, UpstreamProperties properties,
                                           ObjectMapper objectMapper, PaymentRecordDecoder decoder) {
        return new WebClientWalletApiClient(webClientBuilder, properties.getBaseUrl(), properties.getApiKeyHeader(),
                Duration.ofMillis(properties.getTimeoutMs()), objectMapper, decoder);
    }

    @Bean
    public IdentifierLedger identifierLedger(StorageProperties storage) {
        return new IdentifierLedger(Path.of(storage.getIdentifierLedgerFile()));
    }

    @Bean
    public BalanceSnapshotStore balanceSnapshotStore(StorageProperties storage) {
        return new BalanceSnapshotStore(Path.of(storage.getBalanceDir()));
    }

    @Bean
    public DonationLedger donationLedger(StorageProperties storage, ObjectMapper objectMapper, Clock clock) {
        return new DonationLedger(Path.of(storage.getDonationsFile()), objectMapper, clock);
    }

    @Bean
    public WalletRegistry walletRegistry(WalletProperties properties) {
        return new WalletRegistry(properties);
    }

    @Bean
    public WalletPoller walletPoller(WalletApiClient client, IdentifierLedger identifierLedger,
                                     DonationLedger donationLedger, BalanceChangeDetector balanceChangeDetector,
                                     PaymentClassifier classifier, PollingProperties polling,
                                     DonationProperties donations, Clock clock) {
        String linkId = donations.isAttributionEnabled() ? donations.getLinkId() : null;
        return new WalletPoller(client, identifierLedger, donationLedger, balanceChangeDetector, classifier,
                polling.getRecentPaymentsCount(), linkId, clock);
    }
}
