package com.lnradar.ingestion.sync.progress;

import com.lnradar.domain.BalanceEvent;
import com.lnradar.domain.ClassifiedEvent;
import com.lnradar.domain.WalletTickResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory view of the latest tick outcome per wallet, for the status endpoint. Not persisted.
 */
@Component
public class WalletStatusTracker {

    static final int RECENT_IDENTIFIERS_LIMIT = 100;

    private final Map<String, WalletStatus> statuses = new ConcurrentHashMap<>();
    private final Deque<String> recentIdentifiers = new ArrayDeque<>();
    private final Clock clock;

    public WalletStatusTracker(Clock clock) {
        this.clock = clock;
    }

    public void onTick(WalletTickResult result) {
        String tag = result.wallet().tag();
        Instant now = clock.instant();
        WalletStatus prev = statuses.get(tag);
        Long balance = prev != null ? prev.balance() : null;
        String lastChange = prev != null ? prev.lastChange() : null;
        Instant lastSuccessAt = prev != null ? prev.lastSuccessAt() : null;
        if (result.fetched()) {
            balance = result.balance();
            lastSuccessAt = now;
            if (result.balanceEvent().isPresent()) {
                lastChange = describe(result.balanceEvent().get());
            }
        }
        statuses.put(tag, new WalletStatus(tag, result.wallet().displayName(), balance, lastChange, lastSuccessAt, now));

        synchronized (recentIdentifiers) {
            for (ClassifiedEvent e : result.payments()) {
                recentIdentifiers.addFirst(e.identifier().value());
            }
            while (recentIdentifiers.size() > RECENT_IDENTIFIERS_LIMIT) {
                recentIdentifiers.removeLast();
            }
        }
    }

    public List<WalletStatus> statuses() {
        return statuses.values().stream()
                .sorted(Comparator.comparing(WalletStatus::walletTag))
                .toList();
    }

    /**
     * Most recent first.
     */
    public List<String> recentIdentifiers() {
        synchronized (recentIdentifiers) {
            return List.copyOf(recentIdentifiers);
        }
    }

    private static String describe(BalanceEvent event) {
        if (event.type() == BalanceEvent.Type.INITIAL_BALANCE_SET) {
            return "Initial balance set.";
        }
        return "Balance " + (event.delta() > 0 ? "increased" : "decreased") + " by " + Math.abs(event.delta()) + ".";
    }

    /**
     * @param balance       last fetched balance in whole units, null until a fetch succeeded
     * @param lastSuccessAt last tick whose fetch succeeded
     * @param lastTickAt    last tick attempted
     */
    public record WalletStatus(String walletTag, String displayName, Long balance, String lastChange,
                               Instant lastSuccessAt, Instant lastTickAt) {
    }
}
