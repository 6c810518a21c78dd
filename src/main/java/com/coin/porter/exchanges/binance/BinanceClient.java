package com.coin.porter.exchanges.binance;

import com.coin.porter.common.exchange.ExchangeName;
import com.coin.porter.common.exchange.impl.BaseExchangeClient;
import com.coin.porter.common.exchange.impl.ExchangeHttpClient;
import com.coin.porter.common.exchange.impl.ListingConventions;
import com.coin.porter.common.model.ExchangeCapabilities;
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

public class BinanceClient extends BaseExchangeClient {
    public BinanceClient(AppProperties.ExchangeConfig cfg,
                         SecretsProperties.ExchangeSecrets secrets,
                         ListingConventions conventions,
                         ExchangeHttpClient http) {
        super(ExchangeName.BINANCE, cfg, secrets, conventions, http);
    }

    @Override
    public List<VenueCoinListing> getCoinCatalog() {
        String apiKey = apiKey();
        String apiSecret = apiSecret();

        long timestamp = System.currentTimeMillis();
        String query = "timestamp=" + timestamp + "&recvWindow=5000";
        String signature = hmacSha256Hex(apiSecret, query);
        String uri = "/sapi/v1/capital/config/getall?" + query + "&signature=" + signature;

        JsonNode response = get(uri, Map.of("X-MBX-APIKEY", apiKey));
        return parseCatalog(response);
    }

    List<VenueCoinListing> parseCatalog(JsonNode response) {
        if (response == null || !response.isArray()) {
            throw new ExchangeException(name(), "Unexpected response from config API", null);
        }
        List<VenueCoinListing> coins = new ArrayList<>();
        for (JsonNode coin : response) {
            String symbol = textOf(coin, "coin");
            if (StringUtils.isBlank(symbol)) {
                continue;
            }
            List<VenueNetworkListing> networks = new ArrayList<>();
            JsonNode networkList = coin.get("networkList");
            if (networkList != null && networkList.isArray()) {
                for (JsonNode network : networkList) {
                    String label = textOf(network, "network");
                    if (StringUtils.isBlank(label)) {
                        continue;
                    }
                    networks.add(new VenueNetworkListing(
                            label,
                            textOf(network, "contractAddress"),
                            flag(network, "depositEnable"),
                            flag(network, "withdrawEnable"),
                            dec(network, "withdrawMin"),
                            dec(network, "withdrawFee"),
                            textOf(network, "name")
                    ));
                }
            }
            coins.add(toListing(symbol, textOf(coin, "name"), networks));
        }
        return coins;
    }

    @Override
    public ExchangeCapabilities capabilities() {
        return new ExchangeCapabilities(true);
    }
}
