package com.depsync.dispatch.cli;

import com.depsync.config.WorkspaceSessionFactory;
import com.depsync.core.deps.PackageNotFoundException;
import com.depsync.core.deps.RegistryFetchException;
import com.depsync.core.model.AvailableVersion;
import com.depsync.core.model.Registry;
import com.depsync.core.model.ResolveOptions;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: depsync versions &lt;[jsr:|npm:]package&gt;
 * <p>
 * Lists published versions grouped by channel, newest first. Packages without a
 * registry prefix are looked up on JSR.
 */
@Command(name = "versions", mixinStandardHelpOptions = true, description = "List published versions of a package")
@Component
public class VersionsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Package, optionally prefixed with jsr: or npm:")
    private String specifier;

    @Option(names = {"--channel", "-c"}, description = "Only show the latest version on this channel")
    private String channel;

    @Option(names = {"--latest", "-l"}, description = "Only show the latest version")
    private boolean latestOnly;

    @Option(names = {"--include-yanked"}, description = "Include yanked or deprecated versions")
    private boolean includeYanked;

    @Option(names = {"--limit"}, defaultValue = "10", description = "Versions shown per channel (default: ${DEFAULT-VALUE})")
    private int limit;

    private final WorkspaceSessionFactory sessionFactory;

    public VersionsCommand(WorkspaceSessionFactory sessionFactory) {
        this.sessionFactory = sessionFactory;
    }

    @Override
    public Integer call() {
        Registry registry = Registry.JSR;
        String packageName = specifier;
        int colon = specifier.indexOf(':');
        if (colon > 0) {
            try {
                registry = Registry.fromPrefix(specifier.substring(0, colon));
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Unknown registry: " + specifier.substring(0, colon));
                return 2;
            }
            packageName = specifier.substring(colon + 1);
        }

        var resolver = sessionFactory.versionResolver();
        var configured = sessionFactory.resolveOptions();
        var options = new ResolveOptions(configured.timeout(), includeYanked);
        try {
            if (latestOnly || channel != null) {
                var latest = resolver.getLatest(registry, packageName, channel, options);
                if (latest.isEmpty()) {
                    ConsoleOutput.info("No " + (channel != null ? channel : "production") + " version of " + packageName);
                    return 1;
                }
                System.out.println(latest.get());
                return 0;
            }

            Map<String, List<AvailableVersion>> byChannel = resolver.getVersionsByChannel(registry, packageName, options);
            ConsoleOutput.info(registry.prefix() + ":" + packageName);
            for (Map.Entry<String, List<AvailableVersion>> entry : byChannel.entrySet()) {
                System.out.println("  " + entry.getKey() + " (" + entry.getValue().size() + ")");
                entry.getValue().stream().limit(limit).forEach(v -> System.out.println(
                        "    " + v.version() + (v.yanked() ? "  [yanked]" : "")
                        + (v.publishedAt() != null ? "  " + v.publishedAt() : "")));
            }
            return 0;
        } catch (PackageNotFoundException e) {
            ConsoleOutput.error("Package not found: " + packageName);
            return 1;
        } catch (RegistryFetchException | IOException e) {
            ConsoleOutput.error("Registry lookup failed: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted");
            return 1;
        }
    }
}
