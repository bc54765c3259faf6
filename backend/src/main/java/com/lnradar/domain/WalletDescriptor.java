package com.lnradar.domain;

/**
 * One monitored wallet: the read-only credential, a display name and the tag scoping its identifiers
 * and balance snapshot. Built from configuration at startup.
 */
public record WalletDescriptor(String tag, String displayName, String credential) {

    public static final String MAIN_TAG = "main";

    public boolean isMain() {
        return MAIN_TAG.equals(tag);
    }

    @Override
    public String toString() {
        // never print the credential
        return "WalletDescriptor[tag=" + tag + ", displayName=" + displayName + "]";
    }
}
