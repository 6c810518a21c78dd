package com.coin.porter.common.command;

public enum CommandType {
    SEARCH,
    NETWORKS,
    COINS,
    REFRESH,
    HELP,
    EXIT,
    INVALID
}
