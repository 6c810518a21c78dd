package com.coin.porter.common.service;

import com.coin.porter.common.command.Command;
import com.coin.porter.common.command.impl.InvalidCommand;
import com.coin.porter.common.command.impl.NetworksCommand;
import com.coin.porter.common.command.impl.SearchCommand;
import com.coin.porter.common.model.CommandResult;
import com.coin.porter.common.model.ExchangeException;
import com.coin.porter.common.model.MatchRecord;
import com.coin.porter.common.model.ResolutionResult;
import com.coin.porter.common.model.VenueNetworkListing;
import com.coin.porter.common.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
public class CommandExecutor {

    private final CoinSearchService searchService;

    public CommandExecutor(CoinSearchService searchService) {
        this.searchService = searchService;
    }

    public CommandResult execute(Command command) {
        String raw = command.raw();
        LOG.info("COMMAND: {}", LogSanitizer.sanitize(raw));
        try {
            return switch (command.type()) {
                case HELP -> CommandResult.success(helpText());
                case INVALID -> CommandResult.failure(((InvalidCommand) command).error);
                case SEARCH -> handleSearch((SearchCommand) command);
                case NETWORKS -> handleNetworks((NetworksCommand) command);
                case COINS -> handleCoins();
                case REFRESH -> handleRefresh();
                default -> CommandResult.failure("Unsupported command");
            };
        } catch (ExchangeException e) {
            logError(e.getMessage());
            return CommandResult.failure(e.getMessage());
        } catch (Exception e) {
            logError(e.getMessage());
            return CommandResult.failure(String.valueOf(e.getMessage()));
        }
    }

    private static void logError(String e) {
        LOG.error("FAILED: {}", LogSanitizer.sanitize(e));
    }

    private CommandResult handleSearch(SearchCommand cmd) {
        ResolutionResult result = searchService.search(cmd.symbol);
        List<String> lines = new ArrayList<>();
        if (result.verifiedMatches.isEmpty()) {
            lines.add("No listings found for " + cmd.symbol);
        } else {
            lines.add(cmd.symbol + ": " + result.verifiedMatches.size() + " listing(s)");
            for (MatchRecord match : result.verifiedMatches) {
                lines.add("  " + match);
            }
        }
        for (MatchRecord match : result.possibleMatches) {
            lines.add("  possible " + match);
        }
        for (String note : result.notes) {
            if (note.contains("fetch failed")) {
                lines.add("  note: " + note);
            }
        }
        logSuccess(cmd.symbol + " -> " + result.verifiedMatches.size() + " verified");
        return CommandResult.success(lines);
    }

    private CommandResult handleNetworks(NetworksCommand cmd) {
        List<VenueNetworkListing> networks = searchService.networks(cmd.exchange, cmd.symbol);
        if (networks.isEmpty()) {
            return CommandResult.failure(cmd.exchange + " does not list " + cmd.symbol);
        }
        List<String> lines = new ArrayList<>();
        lines.add(cmd.exchange + " " + cmd.symbol + " networks:");
        for (VenueNetworkListing network : networks) {
            lines.add(String.format("  %s deposit=%s withdraw=%s fee=%s min=%s%s",
                    network.network,
                    onOff(network.depositEnabled),
                    onOff(network.withdrawalEnabled),
                    plain(network.withdrawalFee),
                    plain(network.minWithdrawal),
                    network.contractAddress == null ? "" : " contract=" + network.contractAddress));
        }
        logSuccess(cmd.exchange + " " + cmd.symbol + " -> " + networks.size() + " networks");
        return CommandResult.success(lines);
    }

    private CommandResult handleCoins() {
        Map<String, List<String>> currencies = searchService.supportedCurrencies();
        Map<String, String> errors = searchService.fetchErrors();
        List<String> lines = new ArrayList<>();
        currencies.forEach((venue, symbols) -> {
            String error = errors.get(venue);
            lines.add(venue + ": " + symbols.size() + " coins" + (error == null ? "" : " (fetch failed: " + error + ")"));
        });
        return CommandResult.success(lines);
    }

    private CommandResult handleRefresh() {
        searchService.refresh();
        return CommandResult.success("Catalog cache cleared; next lookup fetches fresh data.");
    }

    private static String onOff(boolean value) {
        return value ? "on" : "off";
    }

    private static String plain(BigDecimal value) {
        return value == null ? "-" : value.stripTrailingZeros().toPlainString();
    }

    private static void logSuccess(String message) {
        LOG.info("SUCCESS: {}", message);
    }

    private String helpText() {
        return String.join("\n",
                "Commands:",
                "  search <symbol>               find the coin on every exchange, including renamed listings",
                "  networks <exchange> <symbol>  show deposit/withdrawal terms per network",
                "  coins                         count listed coins per exchange",
                "  refresh                       drop cached exchange data",
                "  help",
                "  exit"
        );
    }
}
