package com.coin.porter.common.config;

import com.coin.porter.common.command.impl.CommandParser;
import com.coin.porter.common.currency.CoinIdentifier;
import com.coin.porter.common.currency.NetworkAliasGroup;
import com.coin.porter.common.currency.NetworkNameStandardizer;
import com.coin.porter.common.exchange.impl.ExchangeRegistry;
import com.coin.porter.common.exchange.impl.ListingConventions;
import com.coin.porter.common.properties.AppProperties;
import com.coin.porter.common.properties.SecretsProperties;
import com.coin.porter.common.service.CatalogFetcher;
import com.coin.porter.common.service.CoinSearchService;
import com.coin.porter.common.service.CommandExecutor;
import com.coin.porter.repl.ReplRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
@EnableConfigurationProperties({AppProperties.class, SecretsProperties.class})
public class ApplicationConfiguration {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NetworkNameStandardizer networkNameStandardizer(AppProperties appProperties) {
        List<AppProperties.NetworkAliasConfig> configured = appProperties.getNetworkAliases();
        if (configured == null || configured.isEmpty()) {
            return NetworkNameStandardizer.withDefaults();
        }
        List<NetworkAliasGroup> groups = configured.stream()
                .map(group -> new NetworkAliasGroup(group.getCode(), group.getAliases()))
                .toList();
        return new NetworkNameStandardizer(groups);
    }

    @Bean
    public ListingConventions listingConventions(NetworkNameStandardizer standardizer) {
        return new ListingConventions(standardizer);
    }

    @Bean
    public ExchangeRegistry exchangeRegistry(AppProperties appProperties, SecretsProperties secretsProperties, ListingConventions conventions) {
        return ExchangeRegistry.create(appProperties, secretsProperties, conventions);
    }

    @Bean
    public CatalogFetcher catalogFetcher(ExchangeRegistry registry, AppProperties appProperties, Clock clock) {
        return new CatalogFetcher(registry, appProperties.getFetch().venueTimeout(), clock);
    }

    @Bean
    public CoinIdentifier coinIdentifier(NetworkNameStandardizer standardizer) {
        return new CoinIdentifier(standardizer);
    }

    @Bean
    public CoinSearchService coinSearchService(CatalogFetcher fetcher, CoinIdentifier identifier, AppProperties appProperties, Clock clock) {
        return new CoinSearchService(fetcher, identifier, Duration.ofSeconds(appProperties.getFetch().getCacheTtlSeconds()), clock);
    }

    @Bean
    public CommandExecutor commandExecutor(CoinSearchService searchService) {
        return new CommandExecutor(searchService);
    }

    @Bean
    public CommandParser commandParser() {
        return new CommandParser();
    }

    @Bean
    public ReplRunner replRunner(CommandParser parser, CommandExecutor executor) {
        return new ReplRunner(parser, executor);
    }
}
