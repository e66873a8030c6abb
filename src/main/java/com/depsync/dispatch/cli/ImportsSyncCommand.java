package com.depsync.dispatch.cli;

import com.depsync.config.WorkspaceSessionFactory;
import com.depsync.core.imports.ImportsSyncException;
import com.depsync.core.imports.ImportsSyncMode;
import com.depsync.core.imports.ImportsSyncResult;
import com.depsync.core.imports.SyncedConfig;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: depsync imports sync &lt;target&gt; --mode local|remote
 * <p>
 * Exits with 1 when no target resolves or any config could not be synced, 2 on an unknown mode.
 */
@Command(name = "sync", mixinStandardHelpOptions = true,
        description = "Switch deno.jsonc imports between jsr specifiers and local workspace paths")
@Component
public class ImportsSyncCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Project name, path to deno.jsonc, or directory")
    private String target;

    @Option(names = {"--mode", "-m"}, required = true,
            description = "'local' (link workspace packages) or 'remote' (restore jsr imports)")
    private String mode;

    @Mixin
    private WorkspaceOptions workspace = new WorkspaceOptions();

    private final WorkspaceSessionFactory sessionFactory;

    public ImportsSyncCommand(WorkspaceSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public Integer call() {
        ImportsSyncMode syncMode;
        try {
            syncMode = ImportsSyncMode.fromName(mode);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Unknown mode: " + mode + " (expected local or remote)");
            return 2;
        }

        ImportsSyncResult result;
        try {
            result = sessionFactory.open(workspace.root).imports().sync(target, syncMode);
        } catch (ImportsSyncException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        ConsoleOutput.info(result.localPackages().size() + " local package(s) linkable");
        result.configs().forEach(ConsoleOutput::syncedConfig);
        long updated = result.count(SyncedConfig.Status.UPDATED);
        ConsoleOutput.success("Synced " + updated + " config(s) to " + syncMode.name().toLowerCase() + " mode");
        return result.count(SyncedConfig.Status.FAILED) > 0 ? 1 : 0;
    }
}
