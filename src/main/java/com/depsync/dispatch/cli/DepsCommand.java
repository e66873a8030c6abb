package com.depsync.dispatch.cli;

import com.depsync.config.WorkspaceSessionFactory;
import com.depsync.core.model.DepsUpgradeOptions;
import com.depsync.core.model.PendingUpgrade;
import com.depsync.core.model.UpgradeMode;
import com.depsync.core.model.UpgradeResult;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: depsync deps [PROJECT]
 * <p>
 * Upgrades a project's declared dependencies to the newest published version on a channel.
 */
@Command(name = "deps", mixinStandardHelpOptions = true,
        description = "Upgrade a project's dependencies to the latest registry versions")
@Component
public class DepsCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Project reference (default: all projects)")
    private String projectRef;

    @Option(names = {"--mode", "-m"}, defaultValue = "ALL",
            description = "Dependencies to consider: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private UpgradeMode mode;

    @Option(names = {"--channel", "-c"}, description = "Prerelease channel to target (default: production)")
    private String channel;

    @Option(names = {"--package"}, description = "Package name or wildcard pattern, e.g. @scope/*")
    private String packagePattern;

    @Option(names = {"--dry-run", "-n"}, description = "Show what would change without writing")
    private boolean dryRun;

    @Mixin
    private WorkspaceOptions workspace = new WorkspaceOptions();

    private final WorkspaceSessionFactory sessionFactory;

    public DepsCommand(WorkspaceSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public Integer call() {
        var planner = sessionFactory.open(workspace.root).planner();
        List<PendingUpgrade> pending = planner.plan(projectRef,
                new DepsUpgradeOptions(mode, channel, packagePattern, dryRun));

        if (pending.isEmpty()) {
            ConsoleOutput.success("All dependencies are up to date");
            return 0;
        }
        pending.forEach(ConsoleOutput::pending);

        List<UpgradeResult> results = planner.apply(pending, dryRun);
        long failed = results.stream().filter(r -> !r.success()).count();
        ConsoleOutput.summary(results.size(), failed, dryRun);
        return failed > 0 ? 1 : 0;
    }
}
