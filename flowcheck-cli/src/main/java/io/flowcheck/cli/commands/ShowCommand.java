package io.flowcheck.cli.commands;

import io.flowcheck.cli.ui.ReportPrinter;
import io.flowcheck.core.report.FlowReport;
import io.flowcheck.serialization.FlowReportSerializer;
import io.flowcheck.serialization.FlowReportWriter;
import jakarta.inject.Inject;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Prints a persisted flow report.
///
/// The argument is either a path to a report file or a flow id, which is looked
/// up as `flow_<id>.json` in the report directory.
///
/// ### Report Directory Resolution
/// 1. CLI option `--report-dir`
/// 2. Config property `flowcheck.report.dir`
/// 3. `reports`
@Command(name = "show", description = "Print a persisted flow report")
class ShowCommand extends FlowCheckCommand {

    @Parameters(index = "0", description = "Flow id or path to a report file")
    String reportRef;

    @Option(names = "--report-dir", description = "Directory holding flow_<id>.json files")
    String reportDir;

    @Option(names = "--json", description = "Print the raw report JSON")
    boolean json;

    @Option(names = "--no-color", description = "Disable colored output", negatable = true)
    boolean color = true;

    @Inject
    @ConfigProperty(name = "flowcheck.report.dir")
    Optional<String> defaultReportDir = Optional.empty();

    @Override
    protected int execute() {
        Path file = locate();
        if (!Files.isRegularFile(file)) {
            System.err.println("Report not found: " + file);
            return EXIT_USAGE;
        }
        try {
            FlowReport report = FlowReportWriter.read(file);
            if (json) {
                System.out.println(FlowReportSerializer.toJson(report));
            } else {
                new ReportPrinter(System.out, color).print(report);
            }
            return EXIT_OK;
        } catch (UncheckedIOException | IllegalArgumentException e) {
            System.err.println("Failed to read report " + file + ": " + e.getMessage());
            return EXIT_USAGE;
        }
    }

    private Path locate() {
        Path direct = Path.of(reportRef);
        if (Files.isRegularFile(direct)) {
            return direct;
        }
        Path directory = Path.of(resolve(reportDir, defaultReportDir).orElse("reports"));
        return directory.resolve(FlowReportWriter.fileName(reportRef));
    }
}
