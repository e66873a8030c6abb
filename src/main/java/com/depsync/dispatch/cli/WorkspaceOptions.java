package com.depsync.dispatch.cli;

import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * Options shared by every command that works on a workspace.
 */
public class WorkspaceOptions {

    @Option(names = {"--root", "-r"}, description = "Workspace root (default: depsync.workspace.root)")
    Path root;
}
