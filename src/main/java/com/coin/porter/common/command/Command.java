package com.coin.porter.common.command;

public interface Command {
    CommandType type();

    String raw();
}
