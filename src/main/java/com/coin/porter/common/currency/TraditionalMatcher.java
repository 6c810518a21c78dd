package com.coin.porter.common.currency;

import com.coin.porter.common.model.MatchRecord;
import com.coin.porter.common.model.VenueCoinListing;
import com.coin.porter.common.model.VenueNetworkListing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class TraditionalMatcher {
    private final DenominationMatcher denominationMatcher;

    public TraditionalMatcher(DenominationMatcher denominationMatcher) {
        this.denominationMatcher = denominationMatcher;
    }

    public List<MatchRecord> match(String querySymbol, Map<String, List<VenueCoinListing>> catalog) {
        List<MatchRecord> matches = new ArrayList<>();
        if (catalog == null) {
            return matches;
        }
        for (Map.Entry<String, List<VenueCoinListing>> venue : catalog.entrySet()) {
            if (venue.getValue() == null) {
                continue;
            }
            for (VenueCoinListing coin : venue.getValue()) {
                if (!isCandidate(coin, querySymbol)) {
                    continue;
                }
                for (VenueNetworkListing network : coin.networks) {
                    matches.add(MatchRecord.traditional(venue.getKey(), coin.symbol, network.network,
                            ContractKey.cleanAddress(network.contractAddress)));
                }
                break;
            }
        }
        return matches;
    }

    public boolean isCandidate(VenueCoinListing coin, String querySymbol) {
        return denominationMatcher.matches(coin.symbol, coin.denomination, querySymbol);
    }
}
