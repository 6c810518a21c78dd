package com.coin.porter.common.util;

import java.io.PrintStream;

public final class ConsoleOutput {
    private static final String GREEN = "\u001B[32m";
    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    private ConsoleOutput() {
    }

    public static String green(String text) {
        return GREEN + text + RESET;
    }

    public static String red(String text) {
        return RED + text + RESET;
    }

    public static void printGreen(PrintStream out, String text) {
        out.print(green(text));
        out.flush();
    }

    public static void printlnGreen(PrintStream out, String text) {
        out.println(green(text));
    }

    public static void printlnRed(PrintStream out, String text) {
        out.println(red(text));
    }
}
