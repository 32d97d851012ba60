package io.flowcheck.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.flowcheck.core.execution.FlowListener;
import io.flowcheck.core.flow.FlowGraph;
import io.flowcheck.core.flow.FlowNode;
import io.flowcheck.core.flow.NodeStatus;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/// Flow listener that leaves one evidence file per completed check.
///
/// Each file is named `validation_<checkId>_<epochMillis>.json` and holds
/// `agent` (the node name), `timestamp`, `action` (`validation_executed`),
/// `flowId` and `payload` (the check outcome). Faulted, blocked and skipped
/// nodes leave no evidence.
///
/// @implNote Called on the flow coordinator thread. Write failures are thrown as
/// {@link UncheckedIOException}; the executor logs them and the flow continues.
public class EvidenceWriter implements FlowListener {

    private static final Logger logger = Logger.getLogger(EvidenceWriter.class.getName());

    static final String ACTION = "validation_executed";

    private final Path directory;
    private final ObjectMapper mapper;
    private final Clock clock;
    private volatile String flowId;

    public EvidenceWriter(Path directory) {
        this(directory, Clock.systemUTC());
    }

    /// @param directory directory receiving evidence files, created on first write, not null
    /// @param clock source of file stamps and the `timestamp` field, not null
    public EvidenceWriter(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.mapper = FlowReportSerializer.createMapper();
    }

    @Override
    public void onFlowStart(String flowId, FlowGraph graph) {
        this.flowId = flowId;
    }

    @Override
    public void onNodeComplete(FlowNode node) {
        if (node.getStatus() != NodeStatus.COMPLETED) {
            return;
        }
        Instant now = clock.instant();
        Map<String, Object> evidence = new LinkedHashMap<>();
        evidence.put("agent", node.getName());
        evidence.put("timestamp", now.toString());
        evidence.put("action", ACTION);
        evidence.put("flowId", flowId);
        evidence.put("payload", node.getOutcome().orElseThrow());

        Path file =
                directory.resolve(
                        "validation_"
                                + node.getDefinition().getCheckId()
                                + "_"
                                + now.toEpochMilli()
                                + ".json");
        try {
            Files.createDirectories(directory);
            Files.writeString(file, mapper.writeValueAsString(evidence));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize evidence for " + node.getId() + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write evidence " + file, e);
        }
        logger.fine("Wrote evidence " + file);
    }
}
