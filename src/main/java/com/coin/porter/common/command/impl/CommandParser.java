package com.coin.porter.common.command.impl;

import com.coin.porter.common.command.Command;

public class CommandParser {
    public Command parse(String line) {
        if (line == null) {
            return new InvalidCommand("", "Empty command");
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return new InvalidCommand(line, "Empty command");
        }
        String[] parts = trimmed.split("\\s+");
        String cmd = parts[0].toLowerCase();

        return switch (cmd) {
            case "search", "find" -> parseSearch(trimmed, parts);
            case "networks" -> parseNetworks(trimmed, parts);
            case "coins" -> new CoinsCommand(trimmed);
            case "refresh" -> new RefreshCommand(trimmed);
            case "help", "?" -> new HelpCommand(trimmed);
            case "exit", "quit" -> new ExitCommand(trimmed);
            default -> new InvalidCommand(trimmed, "Unknown command: " + parts[0]);
        };
    }

    private Command parseSearch(String raw, String[] parts) {
        if (parts.length != 2) {
            return new InvalidCommand(raw, "Syntax: search <symbol>");
        }
        return new SearchCommand(raw, parts[1].toUpperCase());
    }

    private Command parseNetworks(String raw, String[] parts) {
        if (parts.length != 3) {
            return new InvalidCommand(raw, "Syntax: networks <exchange> <symbol>");
        }
        return new NetworksCommand(raw, parts[1].toLowerCase(), parts[2].toUpperCase());
    }
}
