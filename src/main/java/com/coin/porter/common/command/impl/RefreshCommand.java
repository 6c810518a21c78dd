package com.coin.porter.common.command.impl;

import com.coin.porter.common.command.Command;
import com.coin.porter.common.command.CommandType;

public class RefreshCommand implements Command {
    private final String raw;

    public RefreshCommand(String raw) {
        this.raw = raw;
    }

    @Override
    public CommandType type() {
        return CommandType.REFRESH;
    }

    @Override
    public String raw() {
        return raw;
    }
}
