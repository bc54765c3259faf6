package com.lnradar.domain;

/**
 * Balance observation worth reporting. {@code previous} is null for {@link Type#INITIAL_BALANCE_SET}.
 */
public record BalanceEvent(String walletTag, Type type, Long previous, long current, long delta) {

    public enum Type {
        INITIAL_BALANCE_SET,
        BALANCE_CHANGED
    }

    public static BalanceEvent initial(String walletTag, long current) {
        return new BalanceEvent(walletTag, Type.INITIAL_BALANCE_SET, null, current, 0L);
    }

    public static BalanceEvent changed(String walletTag, long previous, long current) {
        return new BalanceEvent(walletTag, Type.BALANCE_CHANGED, previous, current, current - previous);
    }
}
