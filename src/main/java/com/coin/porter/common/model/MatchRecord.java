package com.coin.porter.common.model;

public class MatchRecord {
    public final String venue;
    public final String symbol;
    public final String network;
    public final String contractAddress;
    public final boolean verified;
    public final MatchSource source;

    public MatchRecord(String venue, String symbol, String network, String contractAddress, boolean verified, MatchSource source) {
        this.venue = venue;
        this.symbol = symbol;
        this.network = network;
        this.contractAddress = contractAddress == null ? "" : contractAddress;
        this.verified = verified;
        this.source = source;
    }

    public static MatchRecord traditional(String venue, String symbol, String network, String contractAddress) {
        return new MatchRecord(venue, symbol, network, contractAddress, true, MatchSource.TRADITIONAL);
    }

    public static MatchRecord smart(String venue, String symbol, String network, String contractAddress) {
        return new MatchRecord(venue, symbol, network, contractAddress, true, MatchSource.SMART);
    }

    @Override
    public String toString() {
        return "[" + source.id() + "] " + venue + " " + symbol + " " + network
                + (contractAddress.isEmpty() ? "" : " contract=" + contractAddress);
    }
}
