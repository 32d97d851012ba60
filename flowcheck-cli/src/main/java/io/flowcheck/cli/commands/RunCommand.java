package io.flowcheck.cli.commands;

import io.flowcheck.cli.execution.ConsoleFlowListener;
import io.flowcheck.cli.http.HttpTaskServiceClient;
import io.flowcheck.cli.persistence.DataSourceFactory;
import io.flowcheck.cli.persistence.JdbcTaskStore;
import io.flowcheck.cli.ui.AnsiStyles;
import io.flowcheck.cli.ui.ReportPrinter;
import io.flowcheck.core.FlowConfig;
import io.flowcheck.core.FlowEnvironment;
import io.flowcheck.core.FlowFactory;
import io.flowcheck.core.ValidationScope;
import io.flowcheck.core.report.FlowReport;
import io.flowcheck.core.store.StoreFilter;
import io.flowcheck.serialization.EvidenceWriter;
import io.flowcheck.serialization.FlowReportSerializer;
import io.flowcheck.serialization.FlowReportWriter;
import io.flowcheck.serialization.JacksonStructuredFieldParser;
import jakarta.inject.Inject;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// Runs the validation flow against a task store and prints the verdict.
///
/// ### Usage
/// ```bash
/// flowcheck run --db-url jdbc:sqlite:tasks.db --scope quick
/// flowcheck run --db-url jdbc:postgresql://db/tasks --db-user app --server http://api:8080 \
///     --performance --evidence-dir evidence
/// ```
///
/// ### Option Resolution
/// Connection and directory options fall back to `flowcheck.*` configuration
/// properties when absent from the command line. Behavior checks need a task
/// service; without `--server` (or `flowcheck.server.url`) the `FULL` scope
/// reports them as faults, so use `--scope quick` for store-only validation.
///
/// The exit code is the report's: `0` for `PASSED` and `PASSED_WITH_WARNINGS`,
/// `1` otherwise. Configuration errors exit with `2` before any check runs.
@Command(name = "run", description = "Run the validation flow")
class RunCommand extends FlowCheckCommand {

    @Option(names = "--db-url", description = "JDBC URL of the task store")
    String dbUrl;

    @Option(names = "--db-user", description = "Database user")
    String dbUser;

    @Option(names = "--db-password", description = "Database password")
    String dbPassword;

    @Option(
            names = "--scope",
            defaultValue = "full",
            description = "Validation scope: full, quick (default: ${DEFAULT-VALUE})")
    String scope = "full";

    @Option(names = "--performance", description = "Include the performance check")
    boolean includePerformance;

    @Option(names = "--sequential", description = "Run the checks of a layer one at a time")
    boolean sequential;

    @Option(
            names = "--workers",
            defaultValue = "4",
            description = "Maximum concurrently running checks (default: ${DEFAULT-VALUE})")
    int workers = 4;

    @Option(names = "--project", description = "Restrict store checks to one project")
    String projectId;

    @Option(names = "--sprint", description = "Restrict store checks to one sprint")
    String sprintId;

    @Option(
            names = "--check-timeout",
            defaultValue = "60",
            description = "Per-check timeout in seconds (default: ${DEFAULT-VALUE})")
    long checkTimeoutSeconds = 60;

    @Option(
            names = "--flow-timeout",
            defaultValue = "600",
            description = "Whole-flow timeout in seconds (default: ${DEFAULT-VALUE})")
    long flowTimeoutSeconds = 600;

    @Option(names = "--fail-fast", description = "Skip remaining checks after a failing layer")
    boolean failFast;

    @Option(
            names = "--max-recommendations",
            defaultValue = "10",
            description = "Maximum recommendations in the report (default: ${DEFAULT-VALUE})")
    int maxRecommendations = 10;

    @Option(names = "--report-dir", description = "Directory receiving flow_<id>.json")
    String reportDir;

    @Option(names = "--evidence-dir", description = "Directory for per-check evidence files")
    String evidenceDir;

    @Option(names = "--server", description = "Task service base URL")
    String serverUrl;

    @Option(names = "--token", description = "Bearer token for the task service")
    String token;

    @Option(names = "--no-color", description = "Disable colored output", negatable = true)
    boolean color = true;

    @Inject
    @ConfigProperty(name = "flowcheck.db.url")
    Optional<String> defaultDbUrl = Optional.empty();

    @Inject
    @ConfigProperty(name = "flowcheck.db.user")
    Optional<String> defaultDbUser = Optional.empty();

    @Inject
    @ConfigProperty(name = "flowcheck.db.password")
    Optional<String> defaultDbPassword = Optional.empty();

    @Inject
    @ConfigProperty(name = "flowcheck.report.dir")
    Optional<String> defaultReportDir = Optional.empty();

    @Inject
    @ConfigProperty(name = "flowcheck.evidence.dir")
    Optional<String> defaultEvidenceDir = Optional.empty();

    @Inject
    @ConfigProperty(name = "flowcheck.server.url")
    Optional<String> defaultServerUrl = Optional.empty();

    @Inject
    @ConfigProperty(name = "flowcheck.server.token")
    Optional<String> defaultToken = Optional.empty();

    @Override
    protected int execute() {
        AnsiStyles styles = AnsiStyles.of(color);

        FlowConfig config;
        FactorySetup setup;
        try {
            config = buildConfig();
            setup = prepare(config);
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Invalid configuration:"),
                    e.getMessage());
            return EXIT_USAGE;
        }

        FlowReport report;
        try (FlowEnvironment environment = setup.factory().build()) {
            report = environment.run();
        } catch (IllegalStateException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Flow could not start:"),
                    e.getMessage());
            return EXIT_USAGE;
        }

        new ReportPrinter(System.out, color).print(report);

        try {
            Path written = new FlowReportWriter(setup.reportDirectory()).write(report);
            System.out.printf("%n  %s %s%n", styles.gray("Report written:"), written);
        } catch (UncheckedIOException e) {
            System.err.printf(
                    "%s %s %s%n",
                    styles.crossmark(),
                    styles.bold("Report not saved:"),
                    e.getMessage());
            return EXIT_USAGE;
        }
        return report.exitCode();
    }

    /// Translates the command options into a validated flow configuration.
    FlowConfig buildConfig() {
        FlowConfig config =
                FlowConfig.builder()
                        .scope(ValidationScope.parse(scope))
                        .includePerformance(includePerformance)
                        .parallel(!sequential)
                        .workerPoolSize(workers)
                        .checkTimeout(Duration.ofSeconds(checkTimeoutSeconds))
                        .flowTimeout(Duration.ofSeconds(flowTimeoutSeconds))
                        .failFast(failFast)
                        .filter(StoreFilter.of(projectId, sprintId))
                        .maxRecommendations(maxRecommendations)
                        .build();
        resolve(evidenceDir, defaultEvidenceDir)
                .map(Path::of)
                .ifPresent(config::setEvidenceDirectory);
        config.validate();
        return config;
    }

    private FactorySetup prepare(FlowConfig config) {
        String url =
                resolve(dbUrl, defaultDbUrl)
                        .orElseThrow(
                                () ->
                                        new IllegalArgumentException(
                                                "No database URL. Use --db-url or set "
                                                        + "flowcheck.db.url"));
        var dataSource =
                DataSourceFactory.create(
                        url,
                        resolve(dbUser, defaultDbUser).orElse(null),
                        resolve(dbPassword, defaultDbPassword).orElse(null));

        FlowFactory.Builder factory =
                FlowFactory.builder()
                        .config(config)
                        .store(new JdbcTaskStore(dataSource))
                        .parser(new JacksonStructuredFieldParser())
                        .listener(new ConsoleFlowListener(System.out, color));

        resolve(serverUrl, defaultServerUrl)
                .ifPresent(
                        base ->
                                factory.taskService(
                                        new HttpTaskServiceClient(
                                                base,
                                                resolve(token, defaultToken).orElse(null),
                                                config.getCheckTimeout(),
                                                FlowReportSerializer.createMapper())));
        config.getEvidenceDirectory().ifPresent(dir -> factory.listener(new EvidenceWriter(dir)));

        Path reports = Path.of(resolve(reportDir, defaultReportDir).orElse("reports"));
        return new FactorySetup(factory, reports);
    }

    private record FactorySetup(FlowFactory.Builder factory, Path reportDirectory) {}
}
