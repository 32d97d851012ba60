package io.flowcheck.cli.commands;

import java.util.Optional;
import picocli.CommandLine;

/// Minimal abstract base for all flowcheck commands.
///
/// Owns the banner and the {@link #run()} / {@link #execute()} contract. The value
/// returned by {@link #execute()} becomes the process exit code.
///
/// ### Exit Codes
/// | Code | Meaning |
/// |------|---------|
/// | `0` | success, or a flow verdict of `PASSED` / `PASSED_WITH_WARNINGS` |
/// | `1` | a flow verdict of `DEGRADED` / `FAILED` |
/// | `2` | usage or configuration error, no verdict produced |
public abstract class FlowCheckCommand implements Runnable, CommandLine.IExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;

    private static final String[] BANNER = {
        "",
        "   __ _                   _               _",
        "  / _| | _____      _____| |__   ___  ___| | __",
        " | |_| |/ _ \\ \\ /\\ / / __| '_ \\ / _ \\/ __| |/ /",
        " |  _| | (_) \\ V  V / (__| | | |  __/ (__|   <",
        " |_| |_|\\___/ \\_/\\_/ \\___|_| |_|\\___|\\___|_|\\_\\",
        "",
        " Validation Flow Orchestrator",
        ""
    };

    private int exitCode;

    @Override
    public final void run() {
        for (String line : BANNER) {
            System.out.println(line);
        }
        exitCode = execute();
    }

    /// Runs the command.
    ///
    /// @return the process exit code
    protected abstract int execute();

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /// Returns the option value if set, otherwise the configured default.
    ///
    /// @param option value from the command line, may be null or blank
    /// @param configured default from configuration, not null
    /// @return the effective value, empty if neither is set
    protected static Optional<String> resolve(String option, Optional<String> configured) {
        if (option != null && !option.isBlank()) {
            return Optional.of(option);
        }
        return configured.filter(value -> !value.isBlank());
    }
}
