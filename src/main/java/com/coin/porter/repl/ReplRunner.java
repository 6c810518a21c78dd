package com.coin.porter.repl;

import com.coin.porter.common.command.Command;
import com.coin.porter.common.command.CommandType;
import com.coin.porter.common.command.impl.CommandParser;
import com.coin.porter.common.model.CommandResult;
import com.coin.porter.common.service.CommandExecutor;
import com.coin.porter.common.util.ConsoleOutput;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

@Slf4j
public class ReplRunner {

    private final CommandParser parser;
    private final CommandExecutor executor;

    public ReplRunner(CommandParser parser, CommandExecutor executor) {
        this.parser = parser;
        this.executor = executor;
    }

    public void run() {
        run(System.in, System.out);
    }

    public void run(InputStream in, PrintStream out) {
        ConsoleOutput.printlnGreen(out, "Coin Porter. Type 'help' for commands, 'exit' to quit.");
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            while (true) {
                ConsoleOutput.printGreen(out, "> ");
                String line = reader.readLine();
                if (line == null) {
                    break;
                }
                Command command = parser.parse(line);
                if (command.type() == CommandType.EXIT) {
                    ConsoleOutput.printlnGreen(out, "Bye.");
                    break;
                }
                CommandResult result = executor.execute(command);
                if (result != null && result.message != null && !result.message.isEmpty()) {
                    if (result.success) {
                        ConsoleOutput.printlnGreen(out, result.message);
                    } else {
                        ConsoleOutput.printlnRed(out, result.message);
                    }
                }
            }
        } catch (Exception e) {
            LOG.error("REPL failed: {}", e.getMessage());
            out.println("REPL failed: " + e.getMessage());
        }
    }
}
