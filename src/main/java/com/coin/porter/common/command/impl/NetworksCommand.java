package com.coin.porter.common.command.impl;

import com.coin.porter.common.command.Command;
import com.coin.porter.common.command.CommandType;

public class NetworksCommand implements Command {
    public final String exchange;
    public final String symbol;
    private final String raw;

    public NetworksCommand(String raw, String exchange, String symbol) {
        this.raw = raw;
        this.exchange = exchange;
        this.symbol = symbol;
    }

    @Override
    public CommandType type() {
        return CommandType.NETWORKS;
    }

    @Override
    public String raw() {
        return raw;
    }
}
