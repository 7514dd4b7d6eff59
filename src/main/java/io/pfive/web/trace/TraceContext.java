// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.trace;

import com.google.common.base.MoreObjects;
import io.pfive.web.util.MilliTimer;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import static com.google.common.base.Preconditions.checkNotNull;

/// Mutable state of a trace in progress. Only ever touched by the thread that owns it.
public class TraceContext {

    private UUID sessionId;
    private String type;
    private String name;
    private MilliTimer timer;
    private final Map<String, Object> extra = new LinkedHashMap<>();

    TraceContext () { }

    void setSessionId (UUID sessionId) {
        this.sessionId = sessionId;
    }

    void start (String type, String name, Map<String, ?> startExtra) {
        this.type = checkNotNull(type, "trace type");
        this.name = checkNotNull(name, "trace name");
        this.timer = new MilliTimer();
        this.extra.clear();
        if (startExtra != null) this.extra.putAll(startExtra);
    }

    /// Values supplied at finish replace values of the same key supplied at start.
    CompletedTrace complete (String finishName, Map<String, ?> finishExtra) {
        Map<String, Object> merged = new LinkedHashMap<>(extra);
        if (finishExtra != null) merged.putAll(finishExtra);
        return new CompletedTrace(
                sessionId,
                type,
                name,
                finishName == null ? name : finishName,
                timer.getStartMillis(),
                timer.getElapsedMillis(),
                merged
        );
    }

    public boolean isStarted () {
        return timer != null;
    }

    public UUID sessionId () {
        return sessionId;
    }

    public String type () {
        return type;
    }

    public String name () {
        return name;
    }

    /// Extra values registered when the trace started. A trace that has not started has none.
    public Map<String, Object> extra () {
        return Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    @Override
    public String toString () {
        return MoreObjects.toStringHelper(this)
                .add("sessionId", sessionId)
                .add("type", type)
                .add("name", name)
                .toString();
    }
}
