package com.coin.porter.common.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "app")
@Validated
public class AppProperties {
    @Valid
    private FetchConfig fetch = new FetchConfig();
    @NotEmpty
    private Map<String, @Valid ExchangeConfig> exchanges;
    private List<@Valid NetworkAliasConfig> networkAliases = new ArrayList<>();

    public static class FetchConfig {
        @Min(1)
        private int timeoutSeconds = 60;
        @Min(1)
        private int requestTimeoutSeconds = 15;
        @Min(1)
        private int maxAttempts = 3;
        @Min(0)
        private long initialBackoffMillis = 1000;
        @Min(0)
        private int cacheTtlSeconds = 300;

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public int getRequestTimeoutSeconds() {
            return requestTimeoutSeconds;
        }

        public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
            this.requestTimeoutSeconds = requestTimeoutSeconds;
        }

        // never shorter than every attempt plus every backoff, or retries could not run
        public Duration venueTimeout() {
            int attempts = Math.max(1, maxAttempts);
            long backoffMillis = 0;
            long step = initialBackoffMillis;
            for (int i = 1; i < attempts; i++) {
                backoffMillis += step;
                step *= 2;
            }
            Duration retryBudget = Duration.ofSeconds((long) attempts * requestTimeoutSeconds).plusMillis(backoffMillis);
            Duration configured = Duration.ofSeconds(timeoutSeconds);
            return configured.compareTo(retryBudget) >= 0 ? configured : retryBudget;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMillis() {
            return initialBackoffMillis;
        }

        public void setInitialBackoffMillis(long initialBackoffMillis) {
            this.initialBackoffMillis = initialBackoffMillis;
        }

        public int getCacheTtlSeconds() {
            return cacheTtlSeconds;
        }

        public void setCacheTtlSeconds(int cacheTtlSeconds) {
            this.cacheTtlSeconds = cacheTtlSeconds;
        }
    }

    public static class ExchangeConfig {
        @NotBlank
        private String baseUrl;
        private boolean enabled = true;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class NetworkAliasConfig {
        @NotBlank
        private String code;
        @NotEmpty
        private List<String> aliases;

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public List<String> getAliases() {
            return aliases;
        }

        public void setAliases(List<String> aliases) {
            this.aliases = aliases;
        }
    }

    public FetchConfig getFetch() {
        return fetch;
    }

    public void setFetch(FetchConfig fetch) {
        this.fetch = fetch;
    }

    public Map<String, ExchangeConfig> getExchanges() {
        return exchanges;
    }

    public void setExchanges(Map<String, ExchangeConfig> exchanges) {
        this.exchanges = exchanges;
    }

    public List<NetworkAliasConfig> getNetworkAliases() {
        return networkAliases;
    }

    public void setNetworkAliases(List<NetworkAliasConfig> networkAliases) {
        this.networkAliases = networkAliases;
    }
}
