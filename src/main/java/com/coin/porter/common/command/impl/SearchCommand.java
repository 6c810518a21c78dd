package com.coin.porter.common.command.impl;

import com.coin.porter.common.command.Command;
import com.coin.porter.common.command.CommandType;

public class SearchCommand implements Command {
    public final String symbol;
    private final String raw;

    public SearchCommand(String raw, String symbol) {
        this.raw = raw;
        this.symbol = symbol;
    }

    @Override
    public CommandType type() {
        return CommandType.SEARCH;
    }

    @Override
    public String raw() {
        return raw;
    }
}
