package com.coin.porter.common.currency;

import org.apache.commons.lang3.StringUtils;

import java.util.List;

public class NetworkAliasGroup {
    public final String code;
    public final List<String> aliases;

    public NetworkAliasGroup(String code, List<String> aliases) {
        if (StringUtils.isBlank(code)) {
            throw new IllegalArgumentException("Network code is required");
        }
        this.code = code.trim().toUpperCase();
        this.aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public static NetworkAliasGroup of(String code, String... aliases) {
        return new NetworkAliasGroup(code, List.of(aliases));
    }
}
