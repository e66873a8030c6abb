package com.depsync.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * CLI command group: depsync imports
 */
@Command(name = "imports", mixinStandardHelpOptions = true,
        description = "Manage deno.jsonc import maps",
        subcommands = {ImportsSyncCommand.class})
@Component
public class ImportsCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
