// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.trace;

import io.pfive.web.Configuration;

import java.util.Map;
import java.util.UUID;

/// Static facade over the trace of the unit of work running on the current thread. Javalin runs
/// the before hooks, the endpoint handler and the after hooks of a synchronous request on one
/// thread, so a thread-local is enough to carry the trace from start to finish.
///
/// Completed traces are handed to a TraceSink. Unless one is installed with useSink(), the sink
/// is read from the "trace.sink" configuration key, falling back to logging.
public abstract class Trace {

    public static final String SINK_KEY = "trace.sink";

    private static final ThreadLocal<TraceContext> CURRENT = ThreadLocal.withInitial(TraceContext::new);

    private static volatile TraceSink sink;

    /// Discard anything left on this thread, e.g. by a previous request served by the same pooled thread.
    public static void clear () {
        CURRENT.remove();
    }

    public static TraceContext current () {
        return CURRENT.get();
    }

    public static void sessionId (UUID sessionId) {
        current().setSessionId(sessionId);
    }

    public static void start (String type, String name, Map<String, ?> extra) {
        current().start(type, name, extra);
    }

    /// Complete the current trace and pass it to the sink. Does nothing but clear the thread if no
    /// trace was started, which happens when a before hook fails early.
    public static void finish (String name, Map<String, ?> extra) {
        TraceContext context = current();
        clear();
        if (!context.isStarted()) return;
        sink().accept(context.complete(name, extra));
    }

    public static TraceSink sink () {
        TraceSink result = sink;
        if (result == null) {
            result = Configuration.global().instanceVal(SINK_KEY, TraceSink.class, new LoggingTraceSink());
            sink = result;
        }
        return result;
    }

    public static void useSink (TraceSink traceSink) {
        sink = traceSink;
    }

}
