package com.coin.porter.common.currency;

public record ListingRef(String venue, String symbol, String network) {
}
