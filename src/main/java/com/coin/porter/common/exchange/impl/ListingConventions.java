package com.coin.porter.common.exchange.impl;

import com.coin.porter.common.currency.ContractKey;
import com.coin.porter.common.currency.NetworkNameStandardizer;
import com.coin.porter.common.model.VenueNetworkListing;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ListingConventions {
    private static final Pattern POWER_OF_TEN_PREFIX = Pattern.compile("^(10{2,6})(?=[A-Za-z])");
    private static final Pattern MILLION_SHORTHAND = Pattern.compile("^1M(?=[A-Za-z]{2,})");
    private static final String BRC20 = "BRC20";
    private static final String BITCOIN = "BTC";

    private final NetworkNameStandardizer standardizer;

    public ListingConventions(NetworkNameStandardizer standardizer) {
        this.standardizer = standardizer;
    }

    public Integer inferDenomination(String symbol) {
        if (StringUtils.isBlank(symbol)) {
            return null;
        }
        Matcher power = POWER_OF_TEN_PREFIX.matcher(symbol);
        if (power.find()) {
            return Integer.valueOf(power.group(1));
        }
        if (MILLION_SHORTHAND.matcher(symbol).find()) {
            return 1_000_000;
        }
        return null;
    }

    public String baseSymbol(String symbol, Integer denomination) {
        if (symbol == null || denomination == null || denomination <= 1) {
            return symbol;
        }
        String prefix = String.valueOf(denomination);
        if (symbol.startsWith(prefix)) {
            return symbol.substring(prefix.length());
        }
        if (denomination == 1_000_000 && StringUtils.startsWithIgnoreCase(symbol, "1M")) {
            return symbol.substring(2);
        }
        return symbol;
    }

    // inscription tokens on Bitcoin have no contract, so their lower-cased base symbol stands in for one
    public String contractAddressFor(String symbol, Integer denomination, String networkLabel, String contractAddress) {
        if (!ContractKey.isPlaceholder(contractAddress)) {
            return contractAddress.trim();
        }
        String network = standardizer.standardize(networkLabel);
        String base = baseSymbol(symbol, denomination);
        if (StringUtils.isBlank(base)) {
            return null;
        }
        if (BRC20.equals(network) || (BITCOIN.equals(network) && !BITCOIN.equalsIgnoreCase(base))) {
            return base.toLowerCase();
        }
        return null;
    }

    public VenueNetworkListing normalize(String symbol, Integer denomination, VenueNetworkListing listing) {
        String contract = contractAddressFor(symbol, denomination, listing.network, listing.contractAddress);
        return new VenueNetworkListing(
                listing.network,
                contract,
                listing.depositEnabled,
                listing.withdrawalEnabled,
                listing.minWithdrawal,
                listing.withdrawalFee,
                listing.chainType
        );
    }
}
