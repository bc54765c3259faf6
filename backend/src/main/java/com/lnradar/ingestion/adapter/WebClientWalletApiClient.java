package com.lnradar.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lnradar.domain.PayLink;
import com.lnradar.domain.PaymentRecord;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * LNbits-compatible wallet API over WebClient. Calls are blocking with a bounded timeout; the poller runs on a
 * scheduler thread, never on the event loop.
 */
public class WebClientWalletApiClient implements WalletApiClient {

    private static final String WALLET_PATH = "/api/v1/wallet";
    private static final String PAYMENTS_PATH = "/api/v1/payments";
    private static final String PAY_LINKS_PATH = "/lnurlp/api/v1/links";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final PaymentRecordDecoder decoder;
    private final String apiKeyHeader;
    private final Duration timeout;

    public WebClientWalletApiClient(WebClient.Builder builder, String baseUrl, String apiKeyHeader, Duration timeout,
                                    ObjectMapper objectMapper, PaymentRecordDecoder decoder) {
        this.webClient = builder.baseUrl(stripTrailingSlash(baseUrl)).build();
        this.apiKeyHeader = apiKeyHeader;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.decoder = decoder;
    }

    @Override
    public long fetchBalanceMsat(String credential) {
        JsonNode root = getJson(WALLET_PATH, credential);
        JsonNode balance = root.get("balance");
        if (balance == null || !balance.isNumber()) {
            throw new UpstreamException("Wallet response has no numeric balance");
        }
        return balance.longValue();
    }

    @Override
    public List<PaymentRecord> fetchRecentPayments(String credential, int limit) {
        JsonNode root = getJson(PAYMENTS_PATH + "?limit=" + Math.max(1, limit), credential);
        return decoder.decodeList(root);
    }

    @Override
    public List<PayLink> fetchPayLinks(String credential) {
        JsonNode root = getJson(PAY_LINKS_PATH, credential);
        if (!root.isArray()) {
            throw new UpstreamException("Unexpected pay-links payload: expected a JSON array");
        }
        List<PayLink> out = new ArrayList<>();
        for (JsonNode link : root) {
            out.add(new PayLink(
                    PaymentRecordDecoder.textOrNull(link.get("id")),
                    PaymentRecordDecoder.textOrNull(link.get("description")),
                    PaymentRecordDecoder.textOrNull(link.get("username")),
                    PaymentRecordDecoder.textOrNull(link.get("lnurl"))));
        }
        return out;
    }

    private JsonNode getJson(String uri, String credential) {
        String body;
        try {
            body = webClient.get()
                    .uri(uri)
                    .header(apiKeyHeader, credential)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            throw new UpstreamException("GET " + uri + " failed with status " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new UpstreamException("GET " + uri + " failed: " + messageOf(e), e);
        }
        if (body == null || body.isBlank()) {
            throw new UpstreamException("GET " + uri + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            throw new UpstreamException("GET " + uri + " returned malformed JSON", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static String messageOf(Throwable e) {
        Throwable root = e.getCause() != null ? e.getCause() : e;
        return root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
    }
}
