package com.coin.porter.common.exchange.impl;

import com.coin.porter.common.exchange.ExchangeClient;
import com.coin.porter.common.exchange.ExchangeName;
import com.coin.porter.common.model.ExchangeCapabilities;
import com.coin.porter.common.model.ExchangeException;
import com.coin.porter.common.model.VenueCoinListing;
import com.coin.porter.common.model.VenueNetworkListing;
import com.coin.porter.common.properties.AppProperties;
import com.coin.porter.common.properties.SecretsProperties;
import com.coin.porter.common.util.LogSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public abstract class BaseExchangeClient implements ExchangeClient {
    protected static final String USER_AGENT = "coin-porter";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    protected final ExchangeName exchange;
    protected final String baseUrl;
    protected final SecretsProperties.ExchangeSecrets secrets;
    protected final ListingConventions conventions;
    protected final ExchangeHttpClient http;
    protected final WebClient webClient;

    protected BaseExchangeClient(ExchangeName exchange,
                                 AppProperties.ExchangeConfig cfg,
                                 SecretsProperties.ExchangeSecrets secrets,
                                 ListingConventions conventions,
                                 ExchangeHttpClient http) {
        this.exchange = exchange;
        this.baseUrl = cfg == null ? null : cfg.getBaseUrl();
        this.secrets = secrets;
        this.conventions = conventions;
        this.http = http;
        if (StringUtils.isBlank(this.baseUrl)) {
            throw new IllegalStateException("Missing baseUrl for exchange: " + exchange.id());
        }
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(32 * 1024 * 1024))
                .build();
        this.webClient = WebClient.builder()
                .baseUrl(this.baseUrl)
                .exchangeStrategies(strategies)
                .build();
    }

    @Override
    public String name() {
        return exchange.id();
    }

    @Override
    public ExchangeCapabilities capabilities() {
        return new ExchangeCapabilities(false);
    }

    protected JsonNode get(String uri, Map<String, String> headers) {
        LOG.info("{} GET {}", exchange.id(), LogSanitizer.sanitize(uri));
        LOG.debug("{} request headers {}", exchange.id(), LogSanitizer.sanitizeHeaders(headers));
        String body = http.executeWithRetry(exchange.id(), () -> webClient.get()
                .uri(uri)
                .headers(h -> {
                    h.set(HttpHeaders.USER_AGENT, USER_AGENT);
                    headers.forEach(h::set);
                })
                .retrieve()
                .bodyToMono(String.class));
        return readJson(body);
    }

    protected VenueCoinListing toListing(String symbol, String displayName, List<VenueNetworkListing> networks) {
        Integer denomination = conventions.inferDenomination(symbol);
        List<VenueNetworkListing> normalized = new ArrayList<>(networks.size());
        for (VenueNetworkListing network : networks) {
            normalized.add(conventions.normalize(symbol, denomination, network));
        }
        return new VenueCoinListing(exchange.id(), symbol, StringUtils.defaultIfBlank(displayName, symbol), denomination, normalized);
    }

    protected JsonNode readJson(String body) {
        try {
            return MAPPER.readTree(StringUtils.defaultIfBlank(body, "{}"));
        } catch (Exception e) {
            throw new ExchangeException(exchange.id(), "Failed to parse response", e);
        }
    }

    protected String hmacSha256Hex(String secret, String payload) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            byte[] raw = mac.doFinal(payload.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(raw.length * 2);
            for (byte b : raw) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (Exception e) {
            throw new ExchangeException(exchange.id(), "Failed to sign request", e);
        }
    }

    protected String apiKey() {
        String value = secrets == null ? null : secrets.getApiKey();
        if (StringUtils.isBlank(value)) {
            throw new ExchangeException(exchange.id(), "Missing API credentials", null);
        }
        return value;
    }

    protected String apiSecret() {
        String value = secrets == null ? null : secrets.getApiSecret();
        if (StringUtils.isBlank(value)) {
            throw new ExchangeException(exchange.id(), "Missing API credentials", null);
        }
        return value;
    }

    protected static String textOf(JsonNode node, String... keys) {
        if (node == null || keys == null) {
            return null;
        }
        for (String key : keys) {
            if (node.hasNonNull(key)) {
                String value = node.get(key).asText();
                if (StringUtils.isNotBlank(value)) {
                    return value;
                }
            }
        }
        return null;
    }

    protected static BigDecimal dec(JsonNode node, String key) {
        String text = textOf(node, key);
        if (text == null) {
            return null;
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    protected static boolean flag(JsonNode node, String key) {
        if (node == null || !node.hasNonNull(key)) {
            return false;
        }
        JsonNode value = node.get(key);
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        String text = value.asText().trim();
        return "true".equalsIgnoreCase(text) || "1".equals(text);
    }
}
