package io.flowcheck.core.check.builtin;

import io.flowcheck.core.check.StructuredFieldParser;
import io.flowcheck.core.exception.MalformedStructureException;
import io.flowcheck.core.store.TaskRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Reads task-id lists out of the embedded-structure columns.
final class TaskLinks {

    private TaskLinks() {}

    /// Parses a serialized id list.
    ///
    /// @param parser the structure parser, not null
    /// @param text stored text, may be null or blank
    /// @return ids as strings, empty for absent text, never null
    /// @throws MalformedStructureException if the text is present but not a list
    static List<String> ids(StructuredFieldParser parser, String text)
            throws MalformedStructureException {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        for (Object element : parser.parseList(text)) {
            if (element != null) {
                ids.add(String.valueOf(element));
            }
        }
        return ids;
    }

    /// Indexes tasks by id, keeping the first row of a duplicated key.
    static Map<String, TaskRecord> byId(List<TaskRecord> tasks) {
        return tasks.stream()
                .collect(
                        Collectors.toMap(
                                TaskRecord::id,
                                Function.identity(),
                                (first, duplicate) -> first,
                                LinkedHashMap::new));
    }
}
