package com.coin.porter.common.currency;

import com.coin.porter.common.model.MatchRecord;
import com.coin.porter.common.model.VenueCoinListing;
import com.coin.porter.common.model.VenueNetworkListing;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

// two stages of expansion from the seed keys, not a transitive closure
@Slf4j
public class ContractClosureMatcher {
    private final NetworkNameStandardizer standardizer;
    private final TraditionalMatcher traditionalMatcher;

    public ContractClosureMatcher(NetworkNameStandardizer standardizer, TraditionalMatcher traditionalMatcher) {
        this.standardizer = standardizer;
        this.traditionalMatcher = traditionalMatcher;
    }

    public List<MatchRecord> match(String querySymbol,
                                   Map<String, List<VenueCoinListing>> catalog,
                                   List<MatchRecord> traditionalMatches) {
        return match(querySymbol, catalog, ContractIdentityIndex.build(catalog, standardizer), traditionalMatches);
    }

    public List<MatchRecord> match(String querySymbol,
                                   Map<String, List<VenueCoinListing>> catalog,
                                   ContractIdentityIndex index,
                                   List<MatchRecord> traditionalMatches) {
        List<MatchRecord> variants = new ArrayList<>();
        if (catalog == null || catalog.isEmpty()) {
            return variants;
        }
        Set<ListingRef> alreadyFound = new HashSet<>();
        for (MatchRecord match : traditionalMatches) {
            alreadyFound.add(new ListingRef(match.venue, match.symbol, match.network));
        }

        Set<ContractKey> seedKeys = new LinkedHashSet<>();
        for (Map.Entry<String, List<VenueCoinListing>> venue : catalog.entrySet()) {
            if (venue.getValue() == null) {
                continue;
            }
            for (VenueCoinListing coin : venue.getValue()) {
                if (traditionalMatcher.isCandidate(coin, querySymbol)) {
                    collectKeys(coin, seedKeys);
                    // every candidate counts as found, not only the first one per venue
                    for (VenueNetworkListing network : coin.networks) {
                        alreadyFound.add(new ListingRef(venue.getKey(), coin.symbol, network.network));
                    }
                }
            }
        }
        LOG.debug("{}: {} seed contract keys", querySymbol, seedKeys.size());

        Set<String> relatedSymbols = index.symbolsFor(seedKeys);
        LOG.debug("{}: related symbols {}", querySymbol, relatedSymbols);

        Set<ContractKey> expandedKeys = new LinkedHashSet<>();
        for (List<VenueCoinListing> coins : catalog.values()) {
            if (coins == null) {
                continue;
            }
            for (VenueCoinListing coin : coins) {
                if (relatedSymbols.contains(ContractIdentityIndex.normalize(coin.symbol))) {
                    collectKeys(coin, expandedKeys);
                }
            }
        }
        LOG.debug("{}: {} expanded contract keys", querySymbol, expandedKeys.size());

        for (ContractKey key : expandedKeys) {
            for (ListingRef ref : index.holders(key)) {
                if (!alreadyFound.contains(ref)) {
                    variants.add(MatchRecord.smart(ref.venue(), ref.symbol(), ref.network(), key.address()));
                }
            }
        }
        return variants;
    }

    private void collectKeys(VenueCoinListing coin, Set<ContractKey> into) {
        for (VenueNetworkListing network : coin.networks) {
            ContractKey.of(network.contractAddress, network.network, standardizer).ifPresent(into::add);
        }
    }
}
