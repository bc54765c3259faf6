package com.lnradar.domain;

import java.util.List;

/**
 * Application event: periodic digest figures computed for every wallet whose fetch succeeded.
 */
public record DigestReadyEvent(List<WalletDigest> digests) {
}
