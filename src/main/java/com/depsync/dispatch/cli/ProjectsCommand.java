package com.depsync.dispatch.cli;

import com.depsync.config.WorkspaceSessionFactory;
import com.depsync.core.model.ProjectRef;
import com.depsync.core.model.ProjectResolveOptions;
import com.depsync.core.scanner.MultipleProjectsException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: depsync projects [REF]
 * <p>
 * Lists the workspace projects a reference resolves to, or every project when no
 * reference is given.
 */
@Command(name = "projects", mixinStandardHelpOptions = true, description = "List workspace projects")
@Component
public class ProjectsCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1",
            description = "Manifest path, directory, package name, or comma-separated list of them")
    private String ref;

    @Option(names = {"--all", "-a"}, description = "Include projects whose manifest has no name")
    private boolean includeNameless;

    @Option(names = {"--single"}, description = "Fail when more than one project matches")
    private boolean singleOnly;

    @Option(names = {"--first"}, description = "Return only the first matching project")
    private boolean useFirst;

    @Mixin
    private WorkspaceOptions workspace = new WorkspaceOptions();

    private final WorkspaceSessionFactory sessionFactory;

    public ProjectsCommand(WorkspaceSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public Integer call() {
        var session = sessionFactory.open(workspace.root);
        var options = new ProjectResolveOptions(includeNameless, singleOnly, useFirst);

        List<ProjectRef> projects;
        try {
            projects = session.projects().resolve(ref, options);
        } catch (MultipleProjectsException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (projects.isEmpty()) {
            ConsoleOutput.info("No projects found" + (ref != null ? " for '" + ref + "'" : ""));
            return ref != null ? 1 : 0;
        }

        System.out.printf("  %-32s %-30s %-5s %s%n", "NAME", "DIR", "DEV", "TASKS");
        System.out.println("  " + "-".repeat(76));
        for (ProjectRef project : projects) {
            System.out.printf("  %-32s %-30s %-5s %d%n",
                    project.isNamed() ? project.name() : "-",
                    project.dir(),
                    project.hasDev() ? "yes" : "no",
                    project.tasks().size());
        }
        System.out.println();
        ConsoleOutput.info(projects.size() + " project" + (projects.size() != 1 ? "s" : ""));
        return 0;
    }
}
