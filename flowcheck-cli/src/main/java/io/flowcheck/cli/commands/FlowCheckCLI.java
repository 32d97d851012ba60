package io.flowcheck.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the flowcheck command line.
///
/// Subcommands:
/// - `run` - Run the validation flow against a task store and print the verdict
/// - `graph` - Print the validation flow graph as text or Mermaid
/// - `show` - Print a persisted flow report
///
/// @see RunCommand
/// @see GraphCommand
/// @see ShowCommand
@TopCommand
@Command(
        name = "flowcheck",
        description = "Validation flow orchestrator for task-tracking stores",
        mixinStandardHelpOptions = true,
        subcommands = {RunCommand.class, GraphCommand.class, ShowCommand.class})
public class FlowCheckCLI {}
