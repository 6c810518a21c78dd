package com.coin.porter.exchanges.bitget;

import com.coin.porter.common.exchange.ExchangeName;
import com.coin.porter.common.exchange.impl.BaseExchangeClient;
import com.coin.porter.common.exchange.impl.ExchangeHttpClient;
import com.coin.porter.common.exchange.impl.ListingConventions;
import com.coin.porter.common.model.ExchangeException;
import com.coin.porter.common.model.VenueCoinListing;
import com.coin.porter.common.model.VenueNetworkListing;
import com.coin.porter.common.properties.AppProperties;
import com.coin.porter.common.properties.SecretsProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class BitgetClient extends BaseExchangeClient {
    private static final String SUCCESS_CODE = "00000";

    public BitgetClient(AppProperties.ExchangeConfig cfg,
                        SecretsProperties.ExchangeSecrets secrets,
                        ListingConventions conventions,
                        ExchangeHttpClient http) {
        super(ExchangeName.BITGET, cfg, secrets, conventions, http);
    }

    @Override
    public List<VenueCoinListing> getCoinCatalog() {
        return parseCatalog(get("/api/v2/spot/public/coins", Map.of()));
    }

    List<VenueCoinListing> parseCatalog(JsonNode response) {
        if (response == null || !response.has("code")) {
            throw new ExchangeException(name(), "Unexpected response from coins API", null);
        }
        String code = textOf(response, "code");
        if (!SUCCESS_CODE.equals(code)) {
            throw new ExchangeException(name(), "API error: code=" + code + " " + StringUtils.defaultString(textOf(response, "msg")), null);
        }
        List<VenueCoinListing> coins = new ArrayList<>();
        JsonNode data = response.get("data");
        if (data == null || !data.isArray()) {
            return coins;
        }
        for (JsonNode coin : data) {
            String symbol = textOf(coin, "coin", "coinName");
            if (StringUtils.isBlank(symbol)) {
                continue;
            }
            List<VenueNetworkListing> networks = new ArrayList<>();
            JsonNode chains = coin.get("chains");
            if (chains != null && chains.isArray()) {
                for (JsonNode chain : chains) {
                    String label = textOf(chain, "chain");
                    if (StringUtils.isBlank(label)) {
                        continue;
                    }
                    networks.add(new VenueNetworkListing(
                            label,
                            textOf(chain, "contractAddress"),
                            flag(chain, "rechargeable"),
                            flag(chain, "withdrawable"),
                            dec(chain, "minWithdrawAmount"),
                            dec(chain, "withdrawFee"),
                            null
                    ));
                }
            }
            coins.add(toListing(symbol, symbol, networks));
        }
        return coins;
    }
}
