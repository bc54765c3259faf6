package com.lnradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.lnradar.common.TimestampNormalizer;
import com.lnradar.domain.DonationMetadata;
import com.lnradar.domain.PaymentRecord;
import com.lnradar.domain.PaymentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes the upstream payments JSON into {@link PaymentRecord}s. The metadata bag ({@code extra}) is inspected
 * here, once: its {@code link}, {@code comment} and numeric {@code extra} fields become {@link DonationMetadata}.
 * Individual malformed fields decode to null and are judged by the classifier. Non-object entries are skipped
 * with a WARN; only a non-array body fails.
 */
@RequiredArgsConstructor
@Slf4j
public class PaymentRecordDecoder {

    private final TimestampNormalizer timestampNormalizer;

    public List<PaymentRecord> decodeList(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new UpstreamException("Unexpected payments payload: expected a JSON array");
        }
        List<PaymentRecord> out = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode node : root) {
            if (node != null && node.isObject()) {
                out.add(decode(node));
            } else {
                log.warn("Skipping malformed payment entry at index {}: expected a JSON object, got {}",
                        index, node == null ? "null" : node.getNodeType());
            }
            index++;
        }
        return out;
    }

    public PaymentRecord decode(JsonNode node) {
        String hash = textOrNull(node.get("payment_hash"));
        if (hash == null) {
            hash = textOrNull(node.get("checking_id"));
        }
        Long amount = longOrNull(node.get("amount"));
        String memo = textOrNull(node.get("memo"));
        PaymentStatus status = PaymentStatus.fromUpstream(resolveStatus(node));
        Object createdAt = rawValue(node.has("created_at") ? node.get("created_at") : node.get("time"));
        return new PaymentRecord(hash, amount, memo, status, timestampNormalizer.normalize(createdAt),
                decodeDonationMetadata(node.get("extra")));
    }

    static Optional<DonationMetadata> decodeDonationMetadata(JsonNode extra) {
        if (extra == null || !extra.isObject()) {
            return Optional.empty();
        }
        String link = textOrNull(extra.get("link"));
        if (link == null) {
            return Optional.empty();
        }
        return Optional.of(new DonationMetadata(link, textOrNull(extra.get("comment")), longOrNull(extra.get("extra"))));
    }

    private static String resolveStatus(JsonNode node) {
        String status = textOrNull(node.get("status"));
        if (status != null) {
            return status;
        }
        JsonNode pending = node.get("pending");
        if (pending != null && pending.isBoolean() && pending.booleanValue()) {
            return "pending";
        }
        return "completed";
    }

    static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        String text = node.isTextual() ? node.textValue() : node.toString();
        return text.isBlank() ? null : text;
    }

    static Long longOrNull(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.decimalValue().longValue();
        }
        if (node.isTextual()) {
            try {
                return new BigDecimal(node.textValue().strip()).longValue();
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static Object rawValue(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.asText();
    }
}
