package com.coin.porter.common.model;

public enum MatchSource {
    TRADITIONAL("traditional"),
    SMART("smart");

    private final String id;

    MatchSource(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
