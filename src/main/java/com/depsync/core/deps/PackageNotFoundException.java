package com.depsync.core.deps;

/**
 * Thrown when a registry does not know the requested package.
 */
public class PackageNotFoundException extends RegistryFetchException {
    public PackageNotFoundException(String packageName) {
        super("Package not found: " + packageName, 404);
    }
}
