package com.coin.porter.exchanges.bybit;

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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class BybitClient extends BaseExchangeClient {
    private static final String RECV_WINDOW = "5000";
    private static final String COIN_INFO_PATH = "/v5/asset/coin/query-info";

    public BybitClient(AppProperties.ExchangeConfig cfg,
                       SecretsProperties.ExchangeSecrets secrets,
                       ListingConventions conventions,
                       ExchangeHttpClient http) {
        super(ExchangeName.BYBIT, cfg, secrets, conventions, http);
    }

    @Override
    public List<VenueCoinListing> getCoinCatalog() {
        String apiKey = apiKey();
        String apiSecret = apiSecret();

        String timestamp = String.valueOf(System.currentTimeMillis());
        String query = "";
        String signature = hmacSha256Hex(apiSecret, timestamp + apiKey + RECV_WINDOW + query);

        JsonNode response = get(COIN_INFO_PATH, Map.of(
                "X-BAPI-API-KEY", apiKey,
                "X-BAPI-TIMESTAMP", timestamp,
                "X-BAPI-RECV-WINDOW", RECV_WINDOW,
                "X-BAPI-SIGN", signature
        ));
        return parseCatalog(response);
    }

    List<VenueCoinListing> parseCatalog(JsonNode response) {
        if (response == null || !response.has("retCode")) {
            throw new ExchangeException(name(), "Unexpected response from coin info API", null);
        }
        if (response.get("retCode").asInt(-1) != 0) {
            throw new ExchangeException(name(), "API error: " + StringUtils.defaultString(textOf(response, "retMsg"), "Unknown error"), null);
        }
        List<VenueCoinListing> coins = new ArrayList<>();
        JsonNode rows = response.path("result").path("rows");
        if (!rows.isArray()) {
            return coins;
        }
        for (JsonNode row : rows) {
            String symbol = textOf(row, "coin");
            if (StringUtils.isBlank(symbol)) {
                continue;
            }
            List<VenueNetworkListing> networks = new ArrayList<>();
            JsonNode chains = row.get("chains");
            if (chains != null && chains.isArray()) {
                for (JsonNode chain : chains) {
                    String label = textOf(chain, "chain");
                    if (StringUtils.isBlank(label)) {
                        continue;
                    }
                    // blank withdrawFee: withdrawals unsupported on this chain
                    BigDecimal fee = dec(chain, "withdrawFee");
                    networks.add(new VenueNetworkListing(
                            label,
                            textOf(chain, "contractAddress"),
                            flag(chain, "chainDeposit"),
                            fee != null && flag(chain, "chainWithdraw"),
                            dec(chain, "withdrawMin"),
                            fee,
                            textOf(chain, "chainType")
                    ));
                }
            }
            coins.add(toListing(symbol, textOf(row, "name"), networks));
        }
        return coins;
    }

    @Override
    public ExchangeCapabilities capabilities() {
        return new ExchangeCapabilities(true);
    }
}
