package com.depsync.dispatch.cli;

import com.depsync.config.WorkspaceSessionFactory;
import com.depsync.core.model.PackageReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: depsync refs &lt;package&gt;
 */
@Command(name = "refs", mixinStandardHelpOptions = true,
        description = "Find every reference to a package across the workspace")
@Component
public class RefsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Full package name, e.g. @scope/pkg")
    private String packageName;

    @Option(names = {"--json"}, description = "Print the references as JSON")
    private boolean json;

    @Mixin
    private ReferenceFilterOptions filter = new ReferenceFilterOptions();

    @Mixin
    private WorkspaceOptions workspace = new WorkspaceOptions();

    private final WorkspaceSessionFactory sessionFactory;
    private final ObjectMapper objectMapper;

    public RefsCommand(WorkspaceSessionFactory sessionFactory, ObjectMapper objectMapper) {
        this.sessionFactory = sessionFactory;
        this.objectMapper = objectMapper;
    }

    record ReferenceView(String file, int line, String currentVersion, String source, String projectName) {
        static ReferenceView of(PackageReference ref) {
            return new ReferenceView(ref.file(), ref.line(), ref.currentVersion(),
                    ref.source().name().toLowerCase(), ref.projectName());
        }
    }

    record RefsReport(String packageName, int total, List<ReferenceView> references) {}

    @Override
    public Integer call() {
        List<PackageReference> refs;
        try {
            refs = sessionFactory.open(workspace.root).references().findReferences(packageName, filter.toFilter());
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error("Invalid filter: " + e.getMessage());
            return 2;
        }

        if (json) {
            var report = new RefsReport(packageName, refs.size(), refs.stream().map(ReferenceView::of).toList());
            return ConsoleOutput.json(objectMapper, report) ? 0 : 1;
        }

        if (refs.isEmpty()) {
            ConsoleOutput.info("No references to " + packageName);
            return 0;
        }
        ConsoleOutput.info(refs.size() + " reference" + (refs.size() != 1 ? "s" : "") + " to " + packageName);
        refs.forEach(ConsoleOutput::reference);
        return 0;
    }
}
