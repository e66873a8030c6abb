package com.depsync.core.model;

import java.util.List;
import java.util.Set;

/**
 * Narrows which references a scan reports.
 *
 * @param sources             source categories to keep; empty keeps all
 * @param projectRefs         project refs whose references are kept; empty keeps all
 * @param excludedProjectRefs project refs whose references are dropped
 */
public record ReferenceFilter(
    Set<ReferenceSource> sources,
    List<String> projectRefs,
    List<String> excludedProjectRefs
) {

    public ReferenceFilter {
        sources = sources == null ? Set.of() : Set.copyOf(sources);
        projectRefs = projectRefs == null ? List.of() : List.copyOf(projectRefs);
        excludedProjectRefs = excludedProjectRefs == null ? List.of() : List.copyOf(excludedProjectRefs);
    }

    public static ReferenceFilter all() {
        return new ReferenceFilter(Set.of(), List.of(), List.of());
    }

    public boolean acceptsSource(ReferenceSource source) {
        return sources.isEmpty() || sources.contains(source);
    }
}
