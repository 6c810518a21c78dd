package com.coin.porter.common.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

@ConfigurationProperties(prefix = "secrets")
@Validated
public class SecretsProperties {
    private Map<String, @Valid ExchangeSecrets> exchanges;

    public static class ExchangeSecrets {
        @NotBlank
        private String apiKey;
        @NotBlank
        private String apiSecret;

        public ExchangeSecrets() {
        }

        public ExchangeSecrets(String apiKey, String apiSecret) {
            this.apiKey = apiKey;
            this.apiSecret = apiSecret;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getApiSecret() {
            return apiSecret;
        }

        public void setApiSecret(String apiSecret) {
            this.apiSecret = apiSecret;
        }
    }

    public Map<String, ExchangeSecrets> getExchanges() {
        return exchanges;
    }

    public void setExchanges(Map<String, ExchangeSecrets> exchanges) {
        this.exchanges = exchanges;
    }
}
