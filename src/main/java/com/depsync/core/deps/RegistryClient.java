package com.depsync.core.deps;

import com.depsync.core.model.AvailableVersion;
import com.depsync.core.model.Registry;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Fetches the published versions of a package from one registry.
 */
public interface RegistryClient {

    Registry registry();

    /**
     * Returns every published version, yanked or deprecated ones included and flagged.
     *
     * @param packageName full package name, e.g. {@code @scope/name} or {@code zod}
     * @param timeout     request timeout, or {@code null} for the client default
     * @throws PackageNotFoundException if the registry does not know the package
     * @throws RegistryFetchException   on any other non-success response
     * @throws IOException              on network failure or timeout
     */
    List<AvailableVersion> fetchVersions(String packageName, Duration timeout)
            throws IOException, InterruptedException;
}
