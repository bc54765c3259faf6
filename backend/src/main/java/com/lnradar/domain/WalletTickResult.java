package com.lnradar.domain;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one poll tick for one wallet. A failed tick carries no events and committed no state.
 *
 * @param balance fetched balance in whole units, null when the fetch failed
 */
public record WalletTickResult(
        WalletDescriptor wallet,
        Long balance,
        Optional<BalanceEvent> balanceEvent,
        List<ClassifiedEvent> payments
) {

    public static WalletTickResult failed(WalletDescriptor wallet) {
        return new WalletTickResult(wallet, null, Optional.empty(), List.of());
    }

    public static WalletTickResult completed(WalletDescriptor wallet, long balance,
                                             Optional<BalanceEvent> balanceEvent, List<ClassifiedEvent> payments) {
        return new WalletTickResult(wallet, balance, balanceEvent, List.copyOf(payments));
    }

    public boolean fetched() {
        return balance != null;
    }

    public boolean hasEvents() {
        return balanceEvent.isPresent() || !payments.isEmpty();
    }
}
