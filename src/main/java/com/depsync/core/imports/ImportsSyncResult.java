package com.depsync.core.imports;

import java.util.List;

/**
 * Result of {@link ImportsSyncService#sync}.
 *
 * @param localPackages every workspace package that can be linked locally
 * @param configs       one outcome per resolved target, in resolution order
 */
public record ImportsSyncResult(List<LocalPackage> localPackages, List<SyncedConfig> configs) {

    public ImportsSyncResult {
        localPackages = List.copyOf(localPackages);
        configs = List.copyOf(configs);
    }

    public long count(SyncedConfig.Status status) {
        return configs.stream().filter(c -> c.status() == status).count();
    }
}
