package com.depsync.dispatch.cli;

import com.depsync.config.WorkspaceSessionFactory;
import com.depsync.core.model.ReferenceFilter;
import com.depsync.core.model.UpgradeOptions;
import com.depsync.core.model.UpgradeResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: depsync upgrade &lt;package&gt; &lt;version&gt;
 * <p>
 * Rewrites every reference to the package. Exits with 1 when any file could not be updated.
 */
@Command(name = "upgrade", mixinStandardHelpOptions = true,
        description = "Set every reference to a package to one version")
@Component
public class UpgradeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Full package name, e.g. @scope/pkg")
    private String packageName;

    @Parameters(index = "1", description = "Target version")
    private String version;

    @Option(names = {"--dry-run", "-n"}, description = "Show what would change without writing")
    private boolean dryRun;

    @Option(names = {"--json"}, description = "Print the results as JSON")
    private boolean json;

    @Mixin
    private ReferenceFilterOptions filter = new ReferenceFilterOptions();

    @Mixin
    private WorkspaceOptions workspace = new WorkspaceOptions();

    private final WorkspaceSessionFactory sessionFactory;
    private final ObjectMapper objectMapper;

    public UpgradeCommand(WorkspaceSessionFactory sessionFactory, ObjectMapper objectMapper) {
        this.sessionFactory = sessionFactory;
        this.objectMapper = objectMapper;
    }

    record FilterView(List<String> sources, List<String> projects, List<String> excluded) {
        static FilterView of(ReferenceFilter filter) {
            return new FilterView(
                    filter.sources().stream().map(s -> s.name().toLowerCase()).sorted().toList(),
                    filter.projectRefs(), filter.excludedProjectRefs());
        }
    }

    record ResultView(String file, int line, String oldVersion, String newVersion, String source,
                      String projectName, boolean success, String error) {
        static ResultView of(UpgradeResult result) {
            return new ResultView(result.file(), result.line(), result.oldVersion(), result.newVersion(),
                    result.source().name().toLowerCase(), result.projectName(), result.success(), result.error());
        }
    }

    record Summary(int total, long success, long failed) {}

    record UpgradeReport(String packageName, String targetVersion, boolean dryRun, FilterView filter,
                         List<ResultView> results, Summary summary) {}

    @Override
    public Integer call() {
        UpgradeOptions options;
        try {
            options = new UpgradeOptions(version, dryRun, filter.toFilter());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        List<UpgradeResult> results = sessionFactory.open(workspace.root).references().upgrade(packageName, options);
        long failed = results.stream().filter(r -> !r.success()).count();

        if (json) {
            var report = new UpgradeReport(packageName, version, dryRun, FilterView.of(options.filter()),
                    results.stream().map(ResultView::of).toList(),
                    new Summary(results.size(), results.size() - failed, failed));
            if (!ConsoleOutput.json(objectMapper, report)) return 1;
            return failed > 0 ? 1 : 0;
        }

        if (results.isEmpty()) {
            ConsoleOutput.info("Nothing to upgrade: no reference to " + packageName + " differs from " + version);
            return 0;
        }

        results.forEach(result -> ConsoleOutput.upgradeResult(result, dryRun));
        ConsoleOutput.summary(results.size(), failed, dryRun);
        return failed > 0 ? 1 : 0;
    }
}
