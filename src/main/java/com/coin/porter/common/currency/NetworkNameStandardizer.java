package com.coin.porter.common.currency;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

// an alias listed in more than one group (BTC is native and BRC-20) resolves to the first
public class NetworkNameStandardizer {
    private static final Pattern PARENTHESIZED = Pattern.compile("\\([^)]*\\)");

    private final List<NetworkAliasGroup> groups;
    private final Map<String, String> codeByAlias;
    private final Map<String, NetworkAliasGroup> groupByCode;

    public NetworkNameStandardizer(List<NetworkAliasGroup> groups) {
        this.groups = List.copyOf(groups);
        Map<String, String> lookup = new LinkedHashMap<>();
        Map<String, NetworkAliasGroup> byCode = new LinkedHashMap<>();
        for (NetworkAliasGroup group : this.groups) {
            byCode.putIfAbsent(group.code, group);
            for (String alias : group.aliases) {
                String cleaned = clean(alias);
                if (!cleaned.isEmpty()) {
                    lookup.putIfAbsent(cleaned, group.code);
                }
            }
        }
        this.codeByAlias = Collections.unmodifiableMap(lookup);
        this.groupByCode = Collections.unmodifiableMap(byCode);
    }

    public static NetworkNameStandardizer withDefaults() {
        return new NetworkNameStandardizer(defaultGroups());
    }

    public static List<NetworkAliasGroup> defaultGroups() {
        return List.of(
                NetworkAliasGroup.of("BSC", "BSC", "BEP20", "BNB Smart Chain", "BNB Smart Chain (BEP20)", "BEP-20"),
                NetworkAliasGroup.of("ETH", "ETH", "ERC20", "Ethereum", "Ethereum (ERC20)", "ERC-20"),
                NetworkAliasGroup.of("TRX", "TRX", "TRC20", "Tron", "Tron (TRC20)", "TRC-20"),
                NetworkAliasGroup.of("ARBITRUM", "ARBITRUM", "ArbitrumOne", "Arbitrum One", "ARBI", "ARB"),
                NetworkAliasGroup.of("POLYGON", "MATIC", "Polygon", "Polygon PoS", "Polygon POS", "POLYGON"),
                NetworkAliasGroup.of("OPTIMISM", "OPTIMISM", "Optimism", "OP", "OP Mainnet"),
                NetworkAliasGroup.of("AVAX", "AVAXC", "AVAX C-Chain", "CAVAX", "Avalanche C-Chain", "AVAX-C"),
                NetworkAliasGroup.of("SOL", "SOL", "Solana"),
                NetworkAliasGroup.of("BTC", "BTC", "Bitcoin"),
                NetworkAliasGroup.of("XRP", "XRP", "XRP Ledger"),
                NetworkAliasGroup.of("TON", "TON", "The Open Network"),
                NetworkAliasGroup.of("APTOS", "APT", "Aptos"),
                NetworkAliasGroup.of("BRC20", "BRC20", "ORDIBTC", "ORDI-BRC20", "BTC")
        );
    }

    public String standardize(String label) {
        String cleaned = clean(label);
        if (cleaned.isEmpty()) {
            return "";
        }
        return codeByAlias.getOrDefault(cleaned, cleaned);
    }

    public List<String> aliasesOf(String code) {
        String key = clean(code);
        NetworkAliasGroup group = groupByCode.get(key);
        return group == null ? List.of(key) : group.aliases;
    }

    public List<NetworkAliasGroup> groups() {
        return groups;
    }

    private static String clean(String label) {
        if (label == null) {
            return "";
        }
        return PARENTHESIZED.matcher(label).replaceAll("").trim().toUpperCase();
    }
}
