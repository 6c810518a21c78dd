package com.coin.porter.common.service;

import com.coin.porter.common.exchange.ExchangeClient;
import com.coin.porter.common.exchange.impl.ExchangeHttpClient;
import com.coin.porter.common.exchange.impl.ExchangeRegistry;
import com.coin.porter.common.model.CatalogSnapshot;
import com.coin.porter.common.model.ExchangeException;
import com.coin.porter.common.model.VenueCoinListing;
import com.coin.porter.common.properties.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.coin.porter.common.currency.CatalogFixtures.coin;
import static com.coin.porter.common.currency.CatalogFixtures.net;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CatalogFetcherTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private ExchangeRegistry registry;
    private Clock clock;

    @BeforeEach
    void setUp() {
        registry = mock(ExchangeRegistry.class);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    private static ExchangeClient client(String name) {
        ExchangeClient client = mock(ExchangeClient.class);
        when(client.name()).thenReturn(name);
        return client;
    }

    @Test
    void fetchAll_keepsRegistryOrder() {
        ExchangeClient binance = client("binance");
        ExchangeClient bybit = client("bybit");
        List<VenueCoinListing> binanceCoins = List.of(coin("binance", "1000CAT", 1000, net("BSC", "0xcat")));
        List<VenueCoinListing> bybitCoins = List.of(coin("bybit", "CAT", null, net("BSC", "0xcat")));
        when(binance.getCoinCatalog()).thenReturn(binanceCoins);
        when(bybit.getCoinCatalog()).thenReturn(bybitCoins);
        when(registry.getClients()).thenReturn(List.of(binance, bybit));

        CatalogSnapshot snapshot = new CatalogFetcher(registry, Duration.ofSeconds(5), clock).fetchAll();

        assertThat(snapshot.catalog.keySet()).containsExactly("binance", "bybit");
        assertThat(snapshot.catalog.get("binance")).isEqualTo(binanceCoins);
        assertThat(snapshot.catalog.get("bybit")).isEqualTo(bybitCoins);
        assertThat(snapshot.errors).isEmpty();
        assertThat(snapshot.fetchedAt).isEqualTo(NOW);
    }

    @Test
    void fetchAll_failingVenueContributesEmptyCatalogAndError() {
        ExchangeClient binance = client("binance");
        ExchangeClient bitget = client("bitget");
        when(binance.getCoinCatalog()).thenThrow(new ExchangeException("binance", "Missing API credentials", null));
        when(bitget.getCoinCatalog()).thenReturn(List.of(coin("bitget", "SATS", null, net("BRC20", "sats"))));
        when(registry.getClients()).thenReturn(List.of(binance, bitget));

        CatalogSnapshot snapshot = new CatalogFetcher(registry, Duration.ofSeconds(5), clock).fetchAll();

        assertThat(snapshot.catalog.get("binance")).isEmpty();
        assertThat(snapshot.catalog.get("bitget")).hasSize(1);
        assertThat(snapshot.errors).containsExactly(entry("binance", "Missing API credentials"));
    }

    @Test
    void fetchAll_slowVenueTimesOut() {
        ExchangeClient bybit = client("bybit");
        ExchangeClient bitget = client("bitget");
        when(bybit.getCoinCatalog()).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        });
        when(bitget.getCoinCatalog()).thenReturn(List.of());
        when(registry.getClients()).thenReturn(List.of(bybit, bitget));

        CatalogSnapshot snapshot = new CatalogFetcher(registry, Duration.ofMillis(200), clock).fetchAll();

        assertThat(snapshot.catalog).containsKeys("bybit", "bitget");
        assertThat(snapshot.errors).containsOnlyKeys("bybit");
        assertThat(snapshot.errors.get("bybit")).startsWith("timed out");
    }

    @Test
    void fetchAll_timedOutRequestIsRetriedWithinVenueDeadline() {
        AppProperties.FetchConfig fetch = new AppProperties.FetchConfig();
        fetch.setTimeoutSeconds(1);
        fetch.setRequestTimeoutSeconds(1);
        fetch.setMaxAttempts(2);
        fetch.setInitialBackoffMillis(0);
        ExchangeHttpClient http = new ExchangeHttpClient(fetch.getMaxAttempts(),
                Duration.ofMillis(fetch.getInitialBackoffMillis()),
                Duration.ofSeconds(fetch.getRequestTimeoutSeconds()));
        AtomicInteger attempts = new AtomicInteger();
        List<VenueCoinListing> coins = List.of(coin("bybit", "CAT", null, net("BSC", "0xcat")));
        ExchangeClient bybit = client("bybit");
        when(bybit.getCoinCatalog()).thenAnswer(invocation -> http.executeWithRetry("bybit",
                () -> attempts.incrementAndGet() == 1 ? Mono.<List<VenueCoinListing>>never() : Mono.just(coins)));
        when(registry.getClients()).thenReturn(List.of(bybit));

        CatalogSnapshot snapshot = new CatalogFetcher(registry, fetch.venueTimeout(), clock).fetchAll();

        assertThat(snapshot.errors).isEmpty();
        assertThat(snapshot.catalog.get("bybit")).isEqualTo(coins);
        assertThat(attempts).hasValue(2);
    }

    @Test
    void fetchAll_noVenues_isEmpty() {
        when(registry.getClients()).thenReturn(List.of());

        CatalogSnapshot snapshot = new CatalogFetcher(registry, Duration.ofSeconds(5), clock).fetchAll();

        assertThat(snapshot.catalog).isEmpty();
        assertThat(snapshot.errors).isEmpty();
    }
}
