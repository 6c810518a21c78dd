package com.coin.porter.common.currency;

import org.apache.commons.lang3.StringUtils;

import java.util.Optional;
import java.util.Set;

public record ContractKey(String address, String network) {
    private static final Set<String> PLACEHOLDERS = Set.of("null", "none");

    public static Optional<ContractKey> of(String contractAddress, String networkLabel, NetworkNameStandardizer standardizer) {
        if (isPlaceholder(contractAddress)) {
            return Optional.empty();
        }
        return Optional.of(new ContractKey(contractAddress.trim().toLowerCase(), standardizer.standardize(networkLabel)));
    }

    public static boolean isPlaceholder(String contractAddress) {
        return StringUtils.isBlank(contractAddress) || PLACEHOLDERS.contains(contractAddress.trim().toLowerCase());
    }

    public static String cleanAddress(String contractAddress) {
        return isPlaceholder(contractAddress) ? "" : contractAddress.trim();
    }

    @Override
    public String toString() {
        return address + "_" + network;
    }
}
