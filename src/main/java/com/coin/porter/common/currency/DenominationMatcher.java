package com.coin.porter.common.currency;

import org.apache.commons.lang3.StringUtils;

// a leading number only counts when it is the listing's own denomination, so 1INCH never matches INCH
public class DenominationMatcher {
    private static final int MILLION = 1_000_000;
    private static final String MILLION_SHORTHAND = "1M";

    public boolean matches(String listedSymbol, Integer denomination, String querySymbol) {
        if (StringUtils.isAnyBlank(listedSymbol, querySymbol)) {
            return false;
        }
        if (listedSymbol.equalsIgnoreCase(querySymbol)) {
            return true;
        }
        if (denomination == null || denomination <= 1) {
            return false;
        }
        String prefix = String.valueOf(denomination);
        if (listedSymbol.startsWith(prefix)) {
            return listedSymbol.substring(prefix.length()).equalsIgnoreCase(querySymbol);
        }
        if (denomination == MILLION && StringUtils.startsWithIgnoreCase(listedSymbol, MILLION_SHORTHAND)) {
            return listedSymbol.substring(MILLION_SHORTHAND.length()).equalsIgnoreCase(querySymbol);
        }
        return false;
    }
}
