package com.depsync.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for depsync.
 * Routes to subcommands: projects, refs, upgrade, deps, versions, imports.
 */
@Command(
        name = "depsync",
        mixinStandardHelpOptions = true,
        version = "depsync 0.1.0",
        description = "Finds and upgrades package references across a Deno workspace",
        subcommands = {
                ProjectsCommand.class,
                RefsCommand.class,
                UpgradeCommand.class,
                DepsCommand.class,
                VersionsCommand.class,
                ImportsCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class DepsyncCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
