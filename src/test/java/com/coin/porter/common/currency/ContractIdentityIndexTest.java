package com.coin.porter.common.currency;

import com.coin.porter.common.model.VenueCoinListing;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.coin.porter.common.currency.CatalogFixtures.CAT_BSC;
import static com.coin.porter.common.currency.CatalogFixtures.catalog;
import static com.coin.porter.common.currency.CatalogFixtures.coin;
import static com.coin.porter.common.currency.CatalogFixtures.net;
import static org.assertj.core.api.Assertions.assertThat;

class ContractIdentityIndexTest {

    private final NetworkNameStandardizer standardizer = NetworkNameStandardizer.withDefaults();

    @Test
    void contractKey_lowercasesAddressAndStandardizesNetwork() {
        Optional<ContractKey> key = ContractKey.of(" " + CAT_BSC + " ", "BNB Smart Chain (BEP20)", standardizer);

        assertThat(key).contains(new ContractKey(CAT_BSC.toLowerCase(), "BSC"));
        assertThat(key.get().toString()).isEqualTo(CAT_BSC.toLowerCase() + "_BSC");
    }

    @Test
    void contractKey_placeholdersProduceNoKey() {
        assertThat(ContractKey.of(null, "ETH", standardizer)).isEmpty();
        assertThat(ContractKey.of("", "ETH", standardizer)).isEmpty();
        assertThat(ContractKey.of("  ", "ETH", standardizer)).isEmpty();
        assertThat(ContractKey.of("null", "ETH", standardizer)).isEmpty();
        assertThat(ContractKey.of("None", "ETH", standardizer)).isEmpty();
        assertThat(ContractKey.cleanAddress("NULL")).isEmpty();
        assertThat(ContractKey.cleanAddress(" 0xAb ")).isEqualTo("0xAb");
    }

    @Test
    void build_groupsListingsAcrossVenuesByKey() {
        Map<String, List<VenueCoinListing>> catalog = catalog(
                coin("bybit", "CAT", null, net("BSC", CAT_BSC)),
                coin("binance", "1000CAT", 1000, net("BNB Smart Chain (BEP20)", CAT_BSC.toLowerCase()), net("ETH", "null")),
                coin("bitget", "BTC", null, net("BTC", ""))
        );

        ContractIdentityIndex index = ContractIdentityIndex.build(catalog, standardizer);

        ContractKey key = new ContractKey(CAT_BSC.toLowerCase(), "BSC");
        assertThat(index.size()).isEqualTo(1);
        assertThat(index.holders(key)).containsExactly(
                new ListingRef("bybit", "CAT", "BSC"),
                new ListingRef("binance", "1000CAT", "BNB Smart Chain (BEP20)")
        );
        assertThat(index.symbolsFor(List.of(key))).containsExactly("CAT", "1000CAT");
    }

    @Test
    void keysForSymbol_isCaseInsensitiveAndLiteral() {
        Map<String, List<VenueCoinListing>> catalog = catalog(
                coin("binance", "1000CAT", 1000, net("BSC", CAT_BSC))
        );

        ContractIdentityIndex index = ContractIdentityIndex.build(catalog, standardizer);

        assertThat(index.keysForSymbol("1000cat")).hasSize(1);
        assertThat(index.keysForSymbol("CAT")).isEmpty();
        assertThat(index.holders(new ContractKey("0xdead", "ETH"))).isEmpty();
    }

    @Test
    void build_nullCatalog_isEmpty() {
        assertThat(ContractIdentityIndex.build(null, standardizer).size()).isZero();
    }
}
