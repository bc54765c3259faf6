package com.lnradar.ingestion.classifier;

import com.lnradar.common.DisplayUnits;
import com.lnradar.domain.ClassifiedEvent;
import com.lnradar.domain.DonationMetadata;
import com.lnradar.domain.EventIdentifier;
import com.lnradar.domain.PaymentDirection;
import com.lnradar.domain.PaymentRecord;
import com.lnradar.domain.PaymentStatus;
import com.lnradar.ingestion.filter.MemoSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a raw payment into a sign-normalized, unit-normalized {@link ClassifiedEvent}, or a skip.
 * Order: pending, identifier, amount, direction, memo, donation attribution.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaymentClassifier {

    private final MemoSanitizer memoSanitizer;

    /**
     * @param donationLinkId configured donation link; null or blank disables donation attribution
     */
    public Classification classify(PaymentRecord payment, String walletTag, String donationLinkId) {
        if (payment.status() == PaymentStatus.PENDING) {
            return Classification.skip(SkipReason.PENDING);
        }
        if (!payment.hasIdentifier()) {
            log.warn("Skipping payment without identifier for wallet {} (memo: {})", walletTag, payment.memo());
            return Classification.skip(SkipReason.MISSING_IDENTIFIER);
        }
        Long amountMsat = payment.amountMsat();
        if (amountMsat == null) {
            log.warn("Skipping payment {} for wallet {}: amount missing or not numeric", payment.paymentHash(), walletTag);
            return Classification.skip(SkipReason.MALFORMED_AMOUNT);
        }
        if (amountMsat == 0L) {
            log.debug("Skipping zero-amount payment {} for wallet {}", payment.paymentHash(), walletTag);
            return Classification.skip(SkipReason.ZERO_AMOUNT);
        }

        PaymentDirection direction = amountMsat > 0 ? PaymentDirection.INCOMING : PaymentDirection.OUTGOING;
        long amount = DisplayUnits.magnitudeOf(amountMsat);
        String memo = memoSanitizer.sanitize(payment.memo());
        EventIdentifier id = new EventIdentifier(walletTag, payment.paymentHash());

        Optional<DonationMetadata> donation = payment.donationMetadata()
                .filter(meta -> donationLinkId != null && !donationLinkId.isBlank())
                .filter(meta -> donationLinkId.equals(meta.linkId()));
        if (donation.isEmpty()) {
            return Classification.of(new ClassifiedEvent(id, direction, amount, memo, payment.createdAt(),
                    false, null, null));
        }

        DonationMetadata meta = donation.get();
        long donationAmount = meta.amountMsat() != null
                ? DisplayUnits.magnitudeOf(meta.amountMsat())
                : amount;
        String comment = meta.comment() != null && !meta.comment().isBlank()
                ? memoSanitizer.sanitize(meta.comment())
                : memo;
        return Classification.of(new ClassifiedEvent(id, direction, amount, memo, payment.createdAt(),
                true, donationAmount, comment));
    }
}
