package com.depsync.dispatch.cli;

import com.depsync.core.model.ReferenceFilter;
import com.depsync.core.model.ReferenceSource;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Filter options for commands that search package references.
 */
public class ReferenceFilterOptions {

    @Option(names = {"--source", "-s"}, split = ",",
            description = "Only these sources: config, deps, template, docs, other")
    List<String> sources = new ArrayList<>();

    @Option(names = {"--project", "-p"}, split = ",", description = "Only references owned by these projects")
    List<String> projects = new ArrayList<>();

    @Option(names = {"--exclude", "-x"}, split = ",", description = "Skip references owned by these projects")
    List<String> excluded = new ArrayList<>();

    ReferenceFilter toFilter() {
        var parsed = new LinkedHashSet<ReferenceSource>();
        for (String source : sources) {
            parsed.add(ReferenceSource.fromName(source));
        }
        return new ReferenceFilter(parsed, projects, excluded);
    }
}
