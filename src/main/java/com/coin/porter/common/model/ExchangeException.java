package com.coin.porter.common.model;

public class ExchangeException extends RuntimeException {
    private final String userMessage;

    public ExchangeException(String userMessage) {
        this(null, userMessage, null);
    }

    public ExchangeException(String venue, String userMessage, Throwable cause) {
        super(venue == null ? userMessage : venue + ": " + userMessage, cause);
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }
}
