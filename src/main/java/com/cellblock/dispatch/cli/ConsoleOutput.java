package com.cellblock.dispatch.cli;

import com.cellblock.core.events.CellblockEvent;
import picocli.CommandLine;

import java.util.Map;

/**
 * ANSI-colored terminal output utilities for Cellblock CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) CELLBLOCK v0.1.0|@"));
        rule();
    }

    public static void rule() {
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [CELLBLOCK]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void runtime(Map<String, String> description) {
        var line = new StringBuilder();
        description.forEach((key, value) -> line.append(key).append('=').append(value).append(' '));
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(magenta) [RUNTIME]|@ " + line.toString().trim()));
    }

    public static void cellHeader(String container, String evaluation) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(blue) [" + container + "/" + evaluation + "]|@"));
    }

    public static void cellOutput(String output, long ms) {
        if (output != null && !output.isEmpty()) {
            System.out.println(output);
        }
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|faint (" + formatDuration(ms) + ")|@"));
    }

    public static void cellError(String error) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) error:|@ " + error));
    }

    public static void watchEvent(CellblockEvent event) {
        String prefix = switch (event.eventType()) {
            case CellblockEvent.CONTAINER_DOWN -> "@|fg(red),bold [CONTAINER DOWN]|@";
            case CellblockEvent.RUNTIME_DOWN -> "@|fg(red),bold [RUNTIME DOWN]|@";
            case CellblockEvent.RUNTIME_CONNECTED -> "@|fg(green) [CONNECTED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.containerRef() != null ? event.containerRef() : event.runtimeId();
        Object message = event.payload().get("message");
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject
                + (message != null ? ": " + message : "")));
    }

    private static String formatDuration(long ms) {
        if (ms < 1000) return ms + "ms";
        long seconds = ms / 1000;
        if (seconds < 60) return seconds + "s";
        return (seconds / 60) + "m " + (seconds % 60) + "s";
    }
}
