package com.lnradar.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Poll tick settings. Interval is read by the scheduled job through {@code lnradar.polling.interval-ms}.
 */
@ConfigurationProperties(prefix = "lnradar.polling")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class PollingProperties {

    private boolean enabled = true;

    @Positive
    private long intervalMs = 60_000;

    /** N: how many most recent payments are fetched and examined per tick. */
    @Positive
    private int recentPaymentsCount = 21;

    /** Minimum absolute balance delta (whole units) that produces a balance event. */
    @Min(0)
    private long balanceChangeThreshold = 10;

    @NotNull
    private SnapshotAdvance snapshotAdvance = SnapshotAdvance.ALWAYS;

    public enum SnapshotAdvance {
        /** Snapshot follows every successful fetch; deltas are tick-to-tick. */
        ALWAYS,
        /** Snapshot moves only when a balance event is emitted; sub-threshold drift accumulates. */
        ON_EVENT
    }
}
