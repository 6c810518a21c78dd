package com.coin.porter.common.exchange.impl;

import com.coin.porter.common.exchange.ExchangeClient;
import com.coin.porter.common.exchange.ExchangeName;
import com.coin.porter.common.properties.AppProperties;
import com.coin.porter.common.properties.SecretsProperties;
import com.coin.porter.exchanges.binance.BinanceClient;
import com.coin.porter.exchanges.bitget.BitgetClient;
import com.coin.porter.exchanges.bybit.BybitClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class ExchangeRegistry {
    private final Map<ExchangeName, ExchangeClient> clients;

    ExchangeRegistry(Map<ExchangeName, ExchangeClient> clients) {
        this.clients = clients;
    }

    public static ExchangeRegistry create(AppProperties appProperties,
                                          SecretsProperties secretsProperties,
                                          ListingConventions conventions) {
        Map<ExchangeName, SecretsProperties.ExchangeSecrets> secrets = new EnumMap<>(ExchangeName.class);
        if (secretsProperties != null && secretsProperties.getExchanges() != null) {
            secretsProperties.getExchanges().forEach((key, value) -> secrets.put(ExchangeName.from(key), value));
        }
        AppProperties.FetchConfig fetch = appProperties.getFetch();
        ExchangeHttpClient http = new ExchangeHttpClient(
                fetch.getMaxAttempts(),
                Duration.ofMillis(fetch.getInitialBackoffMillis()),
                Duration.ofSeconds(fetch.getRequestTimeoutSeconds())
        );

        Map<ExchangeName, ExchangeClient> map = new EnumMap<>(ExchangeName.class);
        appProperties.getExchanges().forEach((key, cfg) -> {
            ExchangeName exchange = ExchangeName.from(key);
            if (!cfg.isEnabled()) {
                LOG.info("Exchange {} disabled by configuration", exchange.id());
                return;
            }
            ExchangeClient client = createClient(exchange, cfg, secrets.get(exchange), conventions, http);
            if (client.capabilities().requiresCredentials && !secrets.containsKey(exchange)) {
                LOG.warn("Exchange {} needs API credentials for its coin catalog; none configured", exchange.id());
            }
            map.put(exchange, client);
        });
        LOG.info("Registered exchanges: {}", map.keySet());
        return new ExchangeRegistry(map);
    }

    private static ExchangeClient createClient(ExchangeName exchange,
                                               AppProperties.ExchangeConfig cfg,
                                               SecretsProperties.ExchangeSecrets secrets,
                                               ListingConventions conventions,
                                               ExchangeHttpClient http) {
        return switch (exchange) {
            case BINANCE -> new BinanceClient(cfg, secrets, conventions, http);
            case BYBIT -> new BybitClient(cfg, secrets, conventions, http);
            case BITGET -> new BitgetClient(cfg, secrets, conventions, http);
        };
    }

    public List<ExchangeClient> getClients() {
        return new ArrayList<>(clients.values());
    }
}
