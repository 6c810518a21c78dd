package com.coin.porter.common.command.impl;

import com.coin.porter.common.command.Command;
import com.coin.porter.common.command.CommandType;

public class HelpCommand implements Command {
    private final String raw;

    public HelpCommand(String raw) {
        this.raw = raw;
    }

    @Override
    public CommandType type() {
        return CommandType.HELP;
    }

    @Override
    public String raw() {
        return raw;
    }
}
