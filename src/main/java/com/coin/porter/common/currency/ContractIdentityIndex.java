package com.coin.porter.common.currency;

import com.coin.porter.common.model.VenueCoinListing;
import com.coin.porter.common.model.VenueNetworkListing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class ContractIdentityIndex {
    private final Map<ContractKey, List<ListingRef>> refsByKey;
    private final Map<String, Set<ContractKey>> keysBySymbol;

    private ContractIdentityIndex(Map<ContractKey, List<ListingRef>> refsByKey, Map<String, Set<ContractKey>> keysBySymbol) {
        this.refsByKey = refsByKey;
        this.keysBySymbol = keysBySymbol;
    }

    public static ContractIdentityIndex build(Map<String, List<VenueCoinListing>> catalog, NetworkNameStandardizer standardizer) {
        Map<ContractKey, List<ListingRef>> refsByKey = new LinkedHashMap<>();
        Map<String, Set<ContractKey>> keysBySymbol = new LinkedHashMap<>();
        if (catalog != null) {
            for (Map.Entry<String, List<VenueCoinListing>> venue : catalog.entrySet()) {
                if (venue.getValue() == null) {
                    continue;
                }
                for (VenueCoinListing coin : venue.getValue()) {
                    for (VenueNetworkListing network : coin.networks) {
                        ContractKey.of(network.contractAddress, network.network, standardizer).ifPresent(key -> {
                            refsByKey.computeIfAbsent(key, k -> new ArrayList<>())
                                    .add(new ListingRef(venue.getKey(), coin.symbol, network.network));
                            keysBySymbol.computeIfAbsent(normalize(coin.symbol), s -> new LinkedHashSet<>()).add(key);
                        });
                    }
                }
            }
        }
        return new ContractIdentityIndex(refsByKey, keysBySymbol);
    }

    public List<ListingRef> holders(ContractKey key) {
        List<ListingRef> refs = refsByKey.get(key);
        return refs == null ? List.of() : Collections.unmodifiableList(refs);
    }

    public Set<ContractKey> keysForSymbol(String symbol) {
        Set<ContractKey> keys = keysBySymbol.get(normalize(symbol));
        return keys == null ? Set.of() : Collections.unmodifiableSet(keys);
    }

    public Set<String> symbolsFor(Collection<ContractKey> keys) {
        Set<String> symbols = new LinkedHashSet<>();
        for (ContractKey key : keys) {
            for (ListingRef ref : holders(key)) {
                symbols.add(normalize(ref.symbol()));
            }
        }
        return symbols;
    }

    public int size() {
        return refsByKey.size();
    }

    static String normalize(String symbol) {
        return symbol == null ? "" : symbol.trim().toUpperCase();
    }
}
