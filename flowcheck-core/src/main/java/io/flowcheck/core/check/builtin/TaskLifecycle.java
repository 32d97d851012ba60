package io.flowcheck.core.check.builtin;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// The task status lifecycle enforced by the task service.
///
/// ```
/// new ──► in_progress ──► review ──► done
///  │         ▲  │  ▲        │
///  │         │  ▼  └────────┘
///  │        blocked
///  └──► dropped  (reachable from every non-terminal state)
/// ```
///
/// `done` and `dropped` are terminal.
public final class TaskLifecycle {

    public static final String NEW = "new";
    public static final String IN_PROGRESS = "in_progress";
    public static final String BLOCKED = "blocked";
    public static final String REVIEW = "review";
    public static final String DONE = "done";
    public static final String DROPPED = "dropped";

    /// Every status, in lifecycle order.
    public static final List<String> STATUSES =
            List.of(NEW, IN_PROGRESS, BLOCKED, REVIEW, DONE, DROPPED);

    private static final Map<String, Set<String>> TRANSITIONS = standardTransitions();

    private final Map<String, Set<String>> transitions;

    private TaskLifecycle(Map<String, Set<String>> transitions) {
        this.transitions = transitions;
    }

    /// Returns the lifecycle the task service implements.
    public static TaskLifecycle standard() {
        return new TaskLifecycle(TRANSITIONS);
    }

    /// Returns a lifecycle over an arbitrary transition table.
    ///
    /// @param transitions allowed targets per status, not null
    /// @return the lifecycle, never null
    public static TaskLifecycle of(Map<String, Set<String>> transitions) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        transitions.forEach(
                (from, to) -> copy.put(from, Collections.unmodifiableSet(new LinkedHashSet<>(to))));
        return new TaskLifecycle(Collections.unmodifiableMap(copy));
    }

    private static Map<String, Set<String>> standardTransitions() {
        Map<String, Set<String>> table = new LinkedHashMap<>();
        table.put(NEW, orderedSet(IN_PROGRESS, DROPPED));
        table.put(IN_PROGRESS, orderedSet(BLOCKED, REVIEW, DROPPED));
        table.put(BLOCKED, orderedSet(IN_PROGRESS, DROPPED));
        table.put(REVIEW, orderedSet(IN_PROGRESS, DONE, DROPPED));
        table.put(DONE, Set.of());
        table.put(DROPPED, Set.of());
        return Collections.unmodifiableMap(table);
    }

    private static Set<String> orderedSet(String... values) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(values)));
    }

    public Set<String> statuses() {
        return transitions.keySet();
    }

    /// Returns the allowed targets of a status.
    public Set<String> targets(String from) {
        return transitions.getOrDefault(from, Set.of());
    }

    public boolean allows(String from, String to) {
        return targets(from).contains(to);
    }

    public boolean isTerminal(String status) {
        return transitions.containsKey(status) && targets(status).isEmpty();
    }

    public boolean isKnown(String status) {
        return transitions.containsKey(status);
    }

    /// Returns the shortest transition path from `new` to the given status.
    ///
    /// @param target the status to reach, not null
    /// @return the statuses to move through after `new`, ending with `target`;
    /// empty list for `new` itself; empty optional if unreachable
    public Optional<List<String>> pathFromNew(String target) {
        Map<String, String> previous = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>(List.of(NEW));
        previous.put(NEW, null);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target)) {
                List<String> path = new ArrayList<>();
                for (String step = current; !NEW.equals(step); step = previous.get(step)) {
                    path.add(0, step);
                }
                return Optional.of(path);
            }
            for (String next : targets(current)) {
                if (!previous.containsKey(next)) {
                    previous.put(next, current);
                    queue.add(next);
                }
            }
        }
        return Optional.empty();
    }

    /// Checks the table itself for defects.
    ///
    /// Reports targets that are not declared statuses and statuses that cannot
    /// be reached from `new`.
    ///
    /// @return one message per defect, empty for a sound table, never null
    public List<String> structuralProblems() {
        List<String> problems = new ArrayList<>();
        if (!transitions.containsKey(NEW)) {
            problems.add("Initial status '" + NEW + "' is not declared");
            return problems;
        }
        transitions.forEach(
                (from, targets) -> {
                    for (String to : targets) {
                        if (!transitions.containsKey(to)) {
                            problems.add(
                                    "Transition "
                                            + from
                                            + " -> "
                                            + to
                                            + " targets an undefined status");
                        }
                    }
                });
        for (String status : transitions.keySet()) {
            if (pathFromNew(status).isEmpty()) {
                problems.add("Status '" + status + "' is unreachable from '" + NEW + "'");
            }
        }
        return problems;
    }
}
