package com.flagship.split_ledger.fx;

/**
 * The resolution layer that produced an {@link ExchangeRate}.
 * Only {@link #IDENTITY} and {@link #DIRECT} yield exact rates.
 */
public enum RateLayer {
    IDENTITY(false),
    DIRECT(false),
    INVERSE(true),
    BRIDGE(true),
    STATIC(true);

    private final boolean approximate;

    RateLayer(boolean approximate) {
        this.approximate = approximate;
    }

    public boolean isApproximate() {
        return approximate;
    }
}
