package com.coin.porter.common.service;

import com.coin.porter.common.currency.CoinIdentifier;
import com.coin.porter.common.currency.DenominationMatcher;
import com.coin.porter.common.exchange.ExchangeName;
import com.coin.porter.common.model.CatalogSnapshot;
import com.coin.porter.common.model.ResolutionResult;
import com.coin.porter.common.model.VenueCoinListing;
import com.coin.porter.common.model.VenueNetworkListing;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;

@Slf4j
public class CoinSearchService {
    private static final String SNAPSHOT_KEY = "catalog";

    private final CatalogFetcher fetcher;
    private final CoinIdentifier identifier;
    private final DenominationMatcher denominationMatcher = new DenominationMatcher();
    private final Cache<String, CatalogSnapshot> snapshots;

    public CoinSearchService(CatalogFetcher fetcher, CoinIdentifier identifier, Duration cacheTtl, Clock clock) {
        this.fetcher = fetcher;
        this.identifier = identifier;
        this.snapshots = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    public ResolutionResult search(String symbol) {
        CatalogSnapshot snapshot = snapshot();
        ResolutionResult result = identifier.resolve(symbol, snapshot.catalog);
        List<String> fetchNotes = new ArrayList<>();
        snapshot.errors.forEach((venue, error) -> fetchNotes.add(venue + ": fetch failed: " + error));
        return result.withNotes(fetchNotes);
    }

    public List<VenueNetworkListing> networks(String exchange, String symbol) {
        String venue = ExchangeName.from(exchange).id();
        List<VenueCoinListing> coins = snapshot().catalog.get(venue);
        if (coins == null) {
            return List.of();
        }
        for (VenueCoinListing coin : coins) {
            if (denominationMatcher.matches(coin.symbol, coin.denomination, symbol)) {
                return coin.networks;
            }
        }
        return List.of();
    }

    public Map<String, List<String>> supportedCurrencies() {
        Map<String, List<String>> out = new LinkedHashMap<>();
        snapshot().catalog.forEach((venue, coins) -> {
            TreeSet<String> symbols = new TreeSet<>();
            for (VenueCoinListing coin : coins) {
                symbols.add(coin.symbol);
            }
            out.put(venue, new ArrayList<>(symbols));
        });
        return out;
    }

    public Map<String, String> fetchErrors() {
        return snapshot().errors;
    }

    public void refresh() {
        snapshots.invalidateAll();
    }

    CatalogSnapshot snapshot() {
        return snapshots.get(SNAPSHOT_KEY, key -> {
            LOG.info("No fresh catalog snapshot; fetching");
            return fetcher.fetchAll();
        });
    }
}
