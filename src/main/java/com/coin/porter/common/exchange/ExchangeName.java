package com.coin.porter.common.exchange;

import com.coin.porter.common.model.ExchangeException;

public enum ExchangeName {
    BINANCE("binance"),
    BYBIT("bybit"),
    BITGET("bitget");

    private final String id;

    ExchangeName(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static ExchangeName from(String value) {
        if (value == null || value.isBlank()) {
            throw new ExchangeException("Exchange name is required");
        }
        String normalized = canonical(value);
        for (ExchangeName name : values()) {
            if (canonical(name.id).equals(normalized)) {
                return name;
            }
        }
        throw new ExchangeException("Unsupported exchange: " + value);
    }

    private static String canonical(String raw) {
        String trimmed = raw.trim().replace("\uFEFF", "");
        return trimmed.toLowerCase().replaceAll("[^a-z0-9]", "");
    }
}
