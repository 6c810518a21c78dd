package com.coin.porter.common.util;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void sanitize_masksSignatureInQuery() {
        String uri = "/sapi/v1/capital/config/getall?timestamp=1700000000000&recvWindow=5000&signature=abcdef0123";

        assertThat(LogSanitizer.sanitize(uri))
                .isEqualTo("/sapi/v1/capital/config/getall?timestamp=1700000000000&recvWindow=5000&signature=***");
    }

    @Test
    void sanitize_leavesPlainPathAlone() {
        assertThat(LogSanitizer.sanitize("/api/v2/spot/public/coins")).isEqualTo("/api/v2/spot/public/coins");
        assertThat(LogSanitizer.sanitize(null)).isNull();
    }

    @Test
    void sanitizeHeaders_masksCredentialHeaders() {
        Map<String, String> headers = LogSanitizer.sanitizeHeaders(Map.of(
                "X-BAPI-API-KEY", "key",
                "X-BAPI-SIGN", "sig",
                "X-BAPI-TIMESTAMP", "1700000000000"
        ));

        assertThat(headers).containsEntry("X-BAPI-API-KEY", "***")
                .containsEntry("X-BAPI-SIGN", "***")
                .containsEntry("X-BAPI-TIMESTAMP", "1700000000000");
        assertThat(LogSanitizer.sanitizeHeaders(null)).isEmpty();
    }
}
