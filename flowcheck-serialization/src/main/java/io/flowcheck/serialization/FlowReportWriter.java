package io.flowcheck.serialization;

import io.flowcheck.core.report.FlowReport;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/// Persists flow reports as `flow_<flowId>.json` files and reads them back.
///
/// ### Contracts
/// - **Postcondition**: {@link #write} creates the directory if needed and
///   replaces an existing file of the same flow
/// - I/O failures surface as {@link UncheckedIOException}
public class FlowReportWriter {

    private static final Logger logger = Logger.getLogger(FlowReportWriter.class.getName());

    private final Path directory;

    /// @param directory directory receiving report files, not null
    public FlowReportWriter(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    /// Returns the file name a report is written to.
    public static String fileName(String flowId) {
        return "flow_" + flowId + ".json";
    }

    /// Writes a report.
    ///
    /// @param report the report, not null
    /// @return the written file, never null
    /// @throws UncheckedIOException if the directory or file cannot be written
    public Path write(FlowReport report) {
        Path target = directory.resolve(fileName(report.getFlowId()));
        try {
            Files.createDirectories(directory);
            Files.writeString(target, FlowReportSerializer.toJson(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report " + target, e);
        }
        logger.info("Wrote flow report " + target);
        return target;
    }

    /// Reads a report file.
    ///
    /// @param file a file written by {@link #write}, not null
    /// @return the report, never null
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws IllegalArgumentException if the file does not hold a valid report
    public static FlowReport read(Path file) {
        try {
            return FlowReportSerializer.fromJson(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read report " + file, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
