package com.coin.porter.common.exchange.impl;

import com.coin.porter.common.currency.NetworkNameStandardizer;
import com.coin.porter.common.model.VenueNetworkListing;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class ListingConventionsTest {

    private final ListingConventions conventions = new ListingConventions(NetworkNameStandardizer.withDefaults());

    @Test
    void inferDenomination_readsPowerOfTenPrefix() {
        assertThat(conventions.inferDenomination("1000SATS")).isEqualTo(1000);
        assertThat(conventions.inferDenomination("1000CAT")).isEqualTo(1000);
        assertThat(conventions.inferDenomination("1000000MOG")).isEqualTo(1_000_000);
        assertThat(conventions.inferDenomination("100PEPE")).isEqualTo(100);
    }

    @Test
    void inferDenomination_readsMillionShorthand() {
        assertThat(conventions.inferDenomination("1MBABYDOGE")).isEqualTo(1_000_000);
    }

    @Test
    void inferDenomination_ignoresOrdinaryTickers() {
        assertThat(conventions.inferDenomination("1INCH")).isNull();
        assertThat(conventions.inferDenomination("BTC")).isNull();
        assertThat(conventions.inferDenomination("10000")).isNull();
        assertThat(conventions.inferDenomination("10SET")).isNull();
        assertThat(conventions.inferDenomination("")).isNull();
        assertThat(conventions.inferDenomination(null)).isNull();
    }

    @Test
    void baseSymbol_stripsDenominationPrefix() {
        assertThat(conventions.baseSymbol("1000SATS", 1000)).isEqualTo("SATS");
        assertThat(conventions.baseSymbol("1MBABYDOGE", 1_000_000)).isEqualTo("BABYDOGE");
        assertThat(conventions.baseSymbol("SATS", null)).isEqualTo("SATS");
    }

    @Test
    void contractAddressFor_keepsRealContracts() {
        assertThat(conventions.contractAddressFor("USDT", null, "ETH", " 0xdAC17F958D2ee523a2206206994597C13D831ec7 "))
                .isEqualTo("0xdAC17F958D2ee523a2206206994597C13D831ec7");
    }

    @Test
    void contractAddressFor_inscriptionTokensGetSymbolSentinel() {
        assertThat(conventions.contractAddressFor("SATS", null, "BRC20", "")).isEqualTo("sats");
        assertThat(conventions.contractAddressFor("1000SATS", 1000, "BTC", null)).isEqualTo("sats");
        assertThat(conventions.contractAddressFor("ORDI", null, "ORDI-BRC20", "null")).isEqualTo("ordi");
    }

    @Test
    void contractAddressFor_nativeAssetsStayWithoutContract() {
        assertThat(conventions.contractAddressFor("BTC", null, "BTC", "")).isNull();
        assertThat(conventions.contractAddressFor("ETH", null, "ERC20", "none")).isNull();
    }

    @Test
    void normalize_keepsOtherListingFields() {
        VenueNetworkListing listing = new VenueNetworkListing("BTC", "", true, false,
                new BigDecimal("5000"), new BigDecimal("1000"), "BRC20");

        VenueNetworkListing normalized = conventions.normalize("SATS", null, listing);

        assertThat(normalized.contractAddress).isEqualTo("sats");
        assertThat(normalized.network).isEqualTo("BTC");
        assertThat(normalized.depositEnabled).isTrue();
        assertThat(normalized.withdrawalEnabled).isFalse();
        assertThat(normalized.withdrawalFee).isEqualByComparingTo("1000");
        assertThat(normalized.chainType).isEqualTo("BRC20");
    }
}
