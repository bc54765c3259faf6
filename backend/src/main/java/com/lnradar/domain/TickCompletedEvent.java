package com.lnradar.domain;

import java.util.List;

/**
 * Application event: one poll tick across all configured wallets finished. Consumed by notification dispatch.
 */
public record TickCompletedEvent(List<WalletTickResult> results) {
}
