package com.coin.porter.common.command.impl;

import com.coin.porter.common.command.Command;
import com.coin.porter.common.command.CommandType;

public class CoinsCommand implements Command {
    private final String raw;

    public CoinsCommand(String raw) {
        this.raw = raw;
    }

    @Override
    public CommandType type() {
        return CommandType.COINS;
    }

    @Override
    public String raw() {
        return raw;
    }
}
