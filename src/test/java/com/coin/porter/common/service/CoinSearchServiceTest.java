package com.coin.porter.common.service;

import com.coin.porter.common.currency.CoinIdentifier;
import com.coin.porter.common.currency.NetworkNameStandardizer;
import com.coin.porter.common.model.CatalogSnapshot;
import com.coin.porter.common.model.ExchangeException;
import com.coin.porter.common.model.ResolutionResult;
import com.coin.porter.common.model.VenueNetworkListing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.coin.porter.common.currency.CatalogFixtures.CAT_BSC;
import static com.coin.porter.common.currency.CatalogFixtures.catalog;
import static com.coin.porter.common.currency.CatalogFixtures.coin;
import static com.coin.porter.common.currency.CatalogFixtures.net;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CoinSearchServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-15T10:00:00Z");

    private CatalogFetcher fetcher;
    private MutableClock clock;
    private CoinSearchService service;

    @BeforeEach
    void setUp() {
        fetcher = mock(CatalogFetcher.class);
        clock = new MutableClock(T0);
        service = new CoinSearchService(fetcher, new CoinIdentifier(NetworkNameStandardizer.withDefaults()),
                Duration.ofMinutes(5), clock);
        when(fetcher.fetchAll()).thenAnswer(invocation -> new CatalogSnapshot(
                catalog(
                        coin("binance", "1000CAT", null, net("BNB Smart Chain (BEP20)", CAT_BSC)),
                        coin("bybit", "CAT", null, net("BSC", CAT_BSC)),
                        coin("bybit", "BTC", null, net("BTC", ""))
                ),
                Map.of("bitget", "timed out after 30s"),
                clock.instant()));
    }

    @Test
    void search_resolvesAgainstFetchedCatalogAndReportsFetchErrors() {
        ResolutionResult result = service.search("CAT");

        assertThat(result.verifiedMatches).extracting(m -> m.venue + " " + m.symbol)
                .containsExactly("bybit CAT", "binance 1000CAT");
        assertThat(result.notes).endsWith("bitget: fetch failed: timed out after 30s");
    }

    @Test
    void snapshot_isReusedWithinTtl() {
        service.search("CAT");
        clock.advance(Duration.ofMinutes(4));
        service.search("BTC");

        verify(fetcher, times(1)).fetchAll();
    }

    @Test
    void snapshot_isRefetchedAfterTtl() {
        service.search("CAT");
        clock.advance(Duration.ofMinutes(6));
        service.search("CAT");

        verify(fetcher, times(2)).fetchAll();
    }

    @Test
    void refresh_dropsCachedSnapshot() {
        service.search("CAT");
        service.refresh();
        service.search("CAT");

        verify(fetcher, times(2)).fetchAll();
    }

    @Test
    void networks_returnsListingOfFirstMatchingCoin() {
        List<VenueNetworkListing> networks = service.networks("Bybit", "cat");

        assertThat(networks).extracting(n -> n.network).containsExactly("BSC");
        assertThat(service.networks("bitget", "CAT")).isEmpty();
        assertThat(service.networks("binance", "CAT")).isEmpty();
    }

    @Test
    void networks_unknownExchange_throws() {
        assertThatThrownBy(() -> service.networks("kraken", "CAT"))
                .isInstanceOf(ExchangeException.class);
    }

    @Test
    void supportedCurrencies_sortedPerVenue() {
        assertThat(service.supportedCurrencies()).containsExactly(
                Map.entry("binance", List.of("1000CAT")),
                Map.entry("bybit", List.of("BTC", "CAT"))
        );
        assertThat(service.fetchErrors()).containsOnlyKeys("bitget");
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
