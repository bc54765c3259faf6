package com.lnradar.notification;

import com.lnradar.domain.DigestReadyEvent;
import com.lnradar.domain.TickCompletedEvent;
import com.lnradar.domain.WalletDigest;
import com.lnradar.domain.WalletTickResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Turns tick and digest events into channel messages. A send failure is logged and never propagates back into
 * the poll tick; the payments involved are already recorded and will not be re-sent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NotificationDispatcher {

    private final NotificationFormatter formatter;
    private final NotificationChannel channel;

    @EventListener
    public void onTickCompleted(TickCompletedEvent event) {
        for (WalletTickResult result : event.results()) {
            if (!result.hasEvents()) {
                continue;
            }
            if (!result.payments().isEmpty()) {
                send(formatter.transactions(result.wallet(), result.payments()), "transactions", result);
            }
            result.balanceEvent().ifPresent(be ->
                    send(formatter.balance(result.wallet(), be), "balance", result));
        }
    }

    @EventListener
    public void onDigestReady(DigestReadyEvent event) {
        for (WalletDigest digest : event.digests()) {
            try {
                if (!channel.send(formatter.digest(digest), formatter.keyboard())) {
                    log.warn("Digest for wallet {} was not delivered", digest.wallet().tag());
                }
            } catch (RuntimeException e) {
                log.error("Digest for wallet {} failed: {}", digest.wallet().tag(), e.getMessage());
            }
        }
    }

    private void send(String text, String kind, WalletTickResult result) {
        try {
            if (channel.send(text, formatter.keyboard())) {
                log.info("Sent {} notification for wallet {}", kind, result.wallet().tag());
            } else {
                log.warn("{} notification for wallet {} was not delivered", kind, result.wallet().tag());
            }
        } catch (RuntimeException e) {
            log.error("{} notification for wallet {} failed: {}", kind, result.wallet().tag(), e.getMessage());
        }
    }
}
