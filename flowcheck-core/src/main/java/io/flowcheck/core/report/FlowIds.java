package io.flowcheck.core.report;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/// Generates flow ids of the form `FLOW-yyyyMMdd-HHmmss-xxxxxxxx` (UTC time plus
/// eight random hex digits).
public final class FlowIds {

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private FlowIds() {}

    /// Returns a new flow id stamped with the clock's current time.
    ///
    /// @param clock time source, not null
    /// @return the id, never null
    public static String next(Clock clock) {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "FLOW-" + STAMP.format(clock.instant()) + "-" + random;
    }
}
