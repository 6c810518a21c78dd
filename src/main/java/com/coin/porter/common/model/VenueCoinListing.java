package com.coin.porter.common.model;

import java.util.List;

public class VenueCoinListing {
    public final String venue;
    public final String symbol;
    public final String name;
    public final Integer denomination;
    public final List<VenueNetworkListing> networks;

    public VenueCoinListing(String venue, String symbol, String name, Integer denomination, List<VenueNetworkListing> networks) {
        this.venue = venue;
        this.symbol = symbol;
        this.name = name;
        this.denomination = denomination;
        this.networks = networks == null ? List.of() : List.copyOf(networks);
    }
}
