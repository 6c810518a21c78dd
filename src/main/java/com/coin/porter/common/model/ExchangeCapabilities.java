package com.coin.porter.common.model;

public class ExchangeCapabilities {
    public final boolean requiresCredentials;

    public ExchangeCapabilities(boolean requiresCredentials) {
        this.requiresCredentials = requiresCredentials;
    }
}
