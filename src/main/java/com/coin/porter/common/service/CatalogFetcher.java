package com.coin.porter.common.service;

import com.coin.porter.common.exchange.ExchangeClient;
import com.coin.porter.common.exchange.impl.ExchangeRegistry;
import com.coin.porter.common.model.CatalogSnapshot;
import com.coin.porter.common.model.ExchangeException;
import com.coin.porter.common.model.VenueCoinListing;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

// a failed or timed-out venue contributes an empty catalog and an error entry
@Slf4j
public class CatalogFetcher {
    private final ExchangeRegistry registry;
    private final Duration timeout;
    private final Clock clock;

    public CatalogFetcher(ExchangeRegistry registry, Duration timeout, Clock clock) {
        this.registry = registry;
        this.timeout = timeout;
        this.clock = clock;
    }

    public CatalogSnapshot fetchAll() {
        List<ExchangeClient> clients = registry.getClients();
        Map<String, VenueFetch> fetched = Flux.fromIterable(clients)
                .flatMap(this::fetch)
                .collectList()
                .map(list -> list.stream().collect(Collectors.toMap(VenueFetch::venue, Function.identity())))
                .block();

        Map<String, List<VenueCoinListing>> catalog = new LinkedHashMap<>();
        Map<String, String> errors = new LinkedHashMap<>();
        for (ExchangeClient client : clients) {
            VenueFetch result = fetched == null ? null : fetched.get(client.name());
            if (result == null) {
                catalog.put(client.name(), List.of());
                errors.put(client.name(), "no result");
                continue;
            }
            catalog.put(client.name(), result.coins());
            if (result.error() != null) {
                errors.put(client.name(), result.error());
            }
        }
        LOG.info("Fetched catalogs from {} venues ({} failed)", catalog.size(), errors.size());
        return new CatalogSnapshot(catalog, errors, clock.instant());
    }

    private Mono<VenueFetch> fetch(ExchangeClient client) {
        return Mono.fromCallable(client::getCoinCatalog)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .map(coins -> new VenueFetch(client.name(), coins, null))
                .onErrorResume(ex -> {
                    String message = describe(ex);
                    LOG.warn("Catalog fetch failed for {}: {}", client.name(), message);
                    return Mono.just(new VenueFetch(client.name(), List.of(), message));
                });
    }

    private String describe(Throwable ex) {
        if (ex instanceof ExchangeException ee) {
            return ee.getUserMessage();
        }
        if (ex instanceof TimeoutException) {
            return "timed out after " + timeout.toSeconds() + "s";
        }
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }

    private record VenueFetch(String venue, List<VenueCoinListing> coins, String error) {
    }
}
