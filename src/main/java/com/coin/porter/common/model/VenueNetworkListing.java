package com.coin.porter.common.model;

import java.math.BigDecimal;

public class VenueNetworkListing {
    public final String network;
    public final String contractAddress;
    public final boolean depositEnabled;
    public final boolean withdrawalEnabled;
    public final BigDecimal minWithdrawal;
    public final BigDecimal withdrawalFee;
    public final String chainType;

    public VenueNetworkListing(
            String network,
            String contractAddress,
            boolean depositEnabled,
            boolean withdrawalEnabled,
            BigDecimal minWithdrawal,
            BigDecimal withdrawalFee,
            String chainType
    ) {
        this.network = network;
        this.contractAddress = contractAddress;
        this.depositEnabled = depositEnabled;
        this.withdrawalEnabled = withdrawalEnabled;
        this.minWithdrawal = minWithdrawal;
        this.withdrawalFee = withdrawalFee;
        this.chainType = chainType;
    }

    public static VenueNetworkListing of(String network, String contractAddress) {
        return new VenueNetworkListing(network, contractAddress, true, true, null, null, null);
    }
}
