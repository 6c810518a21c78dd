package com.coin.porter.common.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CatalogSnapshot {
    public final Map<String, List<VenueCoinListing>> catalog;
    public final Map<String, String> errors;
    public final Instant fetchedAt;

    public CatalogSnapshot(Map<String, List<VenueCoinListing>> catalog, Map<String, String> errors, Instant fetchedAt) {
        this.catalog = Collections.unmodifiableMap(new LinkedHashMap<>(catalog));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
        this.fetchedAt = fetchedAt;
    }
}
