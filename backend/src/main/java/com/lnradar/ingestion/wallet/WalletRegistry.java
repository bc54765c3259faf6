package com.lnradar.ingestion.wallet;

import com.lnradar.common.WalletTags;
import com.lnradar.domain.WalletDescriptor;
import com.lnradar.ingestion.config.WalletProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable list of monitored wallets built once from configuration: the main wallet first, then additional
 * wallets in configured order. Duplicate credentials are ignored.
 */
@Slf4j
public class WalletRegistry {

    private final List<WalletDescriptor> wallets;

    public WalletRegistry(WalletProperties properties) {
        this.wallets = List.copyOf(build(properties));
        log.info("Monitoring {} wallet(s): {}", wallets.size(), wallets);
    }

    public List<WalletDescriptor> all() {
        return wallets;
    }

    public WalletDescriptor main() {
        return wallets.get(0);
    }

    static List<WalletDescriptor> build(WalletProperties properties) {
        if (properties.getMainKey() == null || properties.getMainKey().isBlank()) {
            throw new IllegalStateException("lnradar.wallets.main-key is required");
        }
        List<WalletDescriptor> out = new ArrayList<>();
        Set<String> credentials = new HashSet<>();
        String mainKey = properties.getMainKey().strip();
        out.add(new WalletDescriptor(WalletDescriptor.MAIN_TAG, properties.getMainName(), mainKey));
        credentials.add(mainKey);

        String additional = properties.getAdditionalKeys();
        if (additional == null || additional.isBlank()) {
            return out;
        }
        for (String entry : additional.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            String name;
            String key;
            int eq = entry.indexOf('=');
            if (eq >= 0) {
                name = entry.substring(0, eq).strip();
                key = entry.substring(eq + 1).strip();
            } else {
                name = null;
                key = entry.strip();
            }
            if (key.isEmpty()) {
                throw new IllegalStateException("Empty credential in lnradar.wallets.additional-keys");
            }
            if (!credentials.add(key)) {
                log.warn("Ignoring duplicate wallet credential in lnradar.wallets.additional-keys");
                continue;
            }
            String displayName = name == null || name.isEmpty() ? "Wallet " + (out.size() + 1) : name;
            out.add(new WalletDescriptor(WalletTags.forCredential(key), displayName, key));
        }
        return out;
    }
}
