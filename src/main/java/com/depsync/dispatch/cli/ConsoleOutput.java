package com.depsync.dispatch.cli;

import com.depsync.core.imports.SyncedConfig;
import com.depsync.core.model.PackageReference;
import com.depsync.core.model.PendingUpgrade;
import com.depsync.core.model.UpgradeResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the depsync CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) DEPSYNC v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [DEPSYNC]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void reference(PackageReference ref) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + ref.source() + "]|@ " + ref.file() + ":" + ref.line() +
                " @|bold " + ref.currentVersion() + "|@ (" + ref.projectName() + ")"));
    }

    public static void pending(PendingUpgrade upgrade) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(yellow) ~|@ " + upgrade.registry().prefix() + ":" + upgrade.packageName() +
                " " + upgrade.currentVersion() + " -> @|bold " + upgrade.newVersion() + "|@ " +
                upgrade.file() + ":" + upgrade.line()));
    }

    public static void upgradeResult(UpgradeResult result, boolean dryRun) {
        String location = result.file() + ":" + result.line();
        if (!result.success()) {
            System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(red) x|@ " + location + " " + result.oldVersion() + " -> " + result.newVersion() +
                    " @|fg(red) " + result.error() + "|@"));
            return;
        }
        String symbol = dryRun ? "@|fg(yellow) ~|@" : "@|fg(green) +|@";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  " + symbol + " " + location + " " + result.oldVersion() + " -> @|bold " + result.newVersion() + "|@"));
    }

    public static void summary(int total, long failed, boolean dryRun) {
        String verb = dryRun ? "would be upgraded" : "upgraded";
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold " + (total - failed) + " reference" + (total - failed != 1 ? "s" : "") + " " + verb + "|@" +
                (failed > 0 ? ", @|fg(red) " + failed + " failed|@" : "")));
    }

    public static void syncedConfig(SyncedConfig config) {
        switch (config.status()) {
            case UPDATED -> success(config.configPath());
            case SKIPPED -> System.out.println(CommandLine.Help.Ansi.AUTO.string(
                    "  @|fg(yellow) -|@ " + config.configPath() + " (" + config.message() + ")"));
            case FAILED -> error(config.configPath() + ": " + config.message());
        }
    }

    /**
     * Prints {@code report} as indented JSON, with no ANSI styling.
     *
     * @return {@code false} when the report could not be serialized
     */
    public static boolean json(ObjectMapper objectMapper, Object report) {
        try {
            System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            return true;
        } catch (JsonProcessingException e) {
            error("Cannot render JSON: " + e.getOriginalMessage());
            return false;
        }
    }
}
