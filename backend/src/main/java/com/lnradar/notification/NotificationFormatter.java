package com.lnradar.notification;

import com.lnradar.domain.BalanceEvent;
import com.lnradar.domain.ClassifiedEvent;
import com.lnradar.domain.WalletDescriptor;
import com.lnradar.domain.WalletDigest;
import com.lnradar.ingestion.config.DonationProperties;
import com.lnradar.ingestion.config.WalletProperties;
import com.lnradar.notification.config.TelegramProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Telegram Markdown message bodies and the shared inline keyboard.
 */
@Component
@RequiredArgsConstructor
public class NotificationFormatter {

    static final String VIEW_TRANSACTIONS_CALLBACK = "view_transactions";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final WalletProperties walletProperties;
    private final DonationProperties donationProperties;
    private final TelegramProperties telegramProperties;
    private final Clock clock;

    public String transactions(WalletDescriptor wallet, List<ClassifiedEvent> events) {
        List<ClassifiedEvent> incoming = events.stream().filter(ClassifiedEvent::isIncoming).toList();
        List<ClassifiedEvent> outgoing = events.stream().filter(e -> !e.isIncoming()).toList();

        StringBuilder sb = new StringBuilder();
        sb.append("⚡ *").append(escape(walletProperties.getInstanceName())).append("* - *Latest Transactions* ⚡\n");
        appendWallet(sb, wallet);
        sb.append('\n');
        appendSection(sb, "🟢 *Incoming Payments:*", incoming);
        appendSection(sb, "🔴 *Outgoing Payments:*", outgoing);
        appendTimestamp(sb);
        return sb.toString();
    }

    public String balance(WalletDescriptor wallet, BalanceEvent event) {
        StringBuilder sb = new StringBuilder();
        sb.append("⚡ *").append(escape(walletProperties.getInstanceName())).append("* - *Balance Update* ⚡\n");
        appendWallet(sb, wallet);
        sb.append('\n');
        if (event.type() == BalanceEvent.Type.INITIAL_BALANCE_SET) {
            sb.append("🔹 *Initial balance set:* `").append(sats(event.current())).append("`\n\n");
        } else {
            String sign = event.delta() > 0 ? "+" : "-";
            sb.append("🔹 *Previous Balance:* `").append(sats(event.previous())).append("`\n");
            sb.append("🔹 *Change:* `").append(sign).append(sats(Math.abs(event.delta()))).append("`\n");
            sb.append("🔹 *New Balance:* `").append(sats(event.current())).append("`\n\n");
        }
        appendTimestamp(sb);
        return sb.toString();
    }

    public String digest(WalletDigest digest) {
        StringBuilder sb = new StringBuilder();
        sb.append("📊 *").append(escape(walletProperties.getInstanceName())).append("* - *Wallet Digest* 📊\n");
        appendWallet(sb, digest.wallet());
        sb.append('\n');
        sb.append("🔹 *Current Balance:* `").append(sats(digest.balance())).append("`\n");
        sb.append("🔹 *Total Incoming:* `").append(sats(digest.incomingTotal())).append("` across `")
                .append(digest.incomingCount()).append("` transactions\n");
        sb.append("🔹 *Total Outgoing:* `").append(sats(digest.outgoingTotal())).append("` across `")
                .append(digest.outgoingCount()).append("` transactions\n\n");
        appendTimestamp(sb);
        return sb.toString();
    }

    /**
     * One button per row: View Details and View Donations only when their URLs are configured.
     */
    public List<List<InlineButton>> keyboard() {
        List<List<InlineButton>> rows = new ArrayList<>();
        if (hasText(telegramProperties.getOverwatchUrl())) {
            rows.add(List.of(InlineButton.link("🔗 View Details", telegramProperties.getOverwatchUrl())));
        }
        if (hasText(donationProperties.getPageUrl())) {
            rows.add(List.of(InlineButton.link("💰 View Donations", donationProperties.getPageUrl())));
        }
        rows.add(List.of(InlineButton.callback("📈 View Transactions", VIEW_TRANSACTIONS_CALLBACK)));
        return rows;
    }

    private void appendSection(StringBuilder sb, String header, List<ClassifiedEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        sb.append(header).append('\n');
        int idx = 1;
        for (ClassifiedEvent e : events) {
            sb.append(idx++).append(". *Amount:* `").append(sats(e.amount())).append("`\n");
            sb.append("   *Memo:* ").append(escape(e.memo())).append('\n');
        }
        sb.append('\n');
    }

    private void appendWallet(StringBuilder sb, WalletDescriptor wallet) {
        sb.append("👛 *Wallet:* ").append(escape(wallet.displayName())).append('\n');
    }

    private void appendTimestamp(StringBuilder sb) {
        sb.append("🕒 *Timestamp:* ").append(TIMESTAMP.format(clock.instant())).append(" UTC");
    }

    static String sats(long amount) {
        return String.format(Locale.US, "%,d sats", amount);
    }

    /** Escapes the legacy-Markdown control characters Telegram interprets. */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '_' || c == '*' || c == '`' || c == '[') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
