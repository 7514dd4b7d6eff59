// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/// A finished trace as handed to a TraceSink. The extra map may contain nulls (it is whatever
/// the application's extra builders returned) so it is wrapped rather than copied with Map.copyOf.
public record CompletedTrace (
        UUID sessionId,
        String type,
        String startName,
        String finishName,
        long startEpochMillis,
        long durationMillis,
        Map<String, Object> extra
) {
    public CompletedTrace {
        extra = Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }
}
