package io.flowcheck.cli.ui;

import io.flowcheck.core.flow.NodeStatus;
import io.flowcheck.core.report.OverallStatus;

/// ANSI styling for console output, with colors keyed to node and flow verdicts.
///
/// Every method returns the styled string; printing is the caller's job. With
/// color disabled every method returns its input unchanged.
///
/// {@snippet :
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.status(NodeStatus.COMPLETED) + " " + styles.bold("integrity"));
/// }
///
/// @implNote Thread-safe. Instances are immutable.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private static final int RULE_WIDTH = 62;

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// @param useColor true to emit ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    public String bold(String text) {
        return style(text, BOLD);
    }

    public String gray(String text) {
        return style(text, GRAY);
    }

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    // --- Verdicts ---

    /// Returns the status name colored by outcome: green for `COMPLETED`, red for
    /// `FAILED`, yellow for `BLOCKED`, gray otherwise.
    public String status(NodeStatus status) {
        String code =
                switch (status) {
                    case COMPLETED -> GREEN;
                    case FAILED -> RED;
                    case BLOCKED -> YELLOW;
                    default -> GRAY;
                };
        return style(status.name(), code);
    }

    /// Returns the flow verdict colored green for success, yellow for `DEGRADED`
    /// and red for `FAILED`.
    public String verdict(OverallStatus status) {
        if (status.isSuccess()) {
            return style(status.name(), GREEN);
        }
        return style(status.name(), status == OverallStatus.DEGRADED ? YELLOW : RED);
    }

    /// Returns a one-character marker for a node's terminal status.
    public String marker(NodeStatus status) {
        return switch (status) {
            case COMPLETED -> checkmark();
            case FAILED -> crossmark();
            case BLOCKED -> style("■", YELLOW);
            case SKIPPED -> style("-", GRAY);
            default -> style("…", GRAY);
        };
    }

    // --- Symbols ---

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    // --- Box Drawing ---

    public String boxTop() {
        return style("┌─", DIM);
    }

    public String boxMid() {
        return style("│", DIM);
    }

    public String boxBottom() {
        return style("└─", DIM);
    }

    /// Full-width horizontal rule.
    public String rule() {
        return style("─".repeat(RULE_WIDTH), DIM);
    }
}
