package com.coin.porter.common.exchange;

import com.coin.porter.common.model.ExchangeCapabilities;
import com.coin.porter.common.model.VenueCoinListing;

import java.util.List;

public interface ExchangeClient {
    String name();

    List<VenueCoinListing> getCoinCatalog();

    ExchangeCapabilities capabilities();
}
