// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http.handler;

import io.javalin.http.Context;
import io.javalin.http.Handler;
import io.pfive.web.error.ErrorReporter;
import io.pfive.web.http.WebTraceExtraBuilder;
import io.pfive.web.trace.Trace;

/// After hook run for every request, finishing the trace started by SessionTraceHandler. The
/// trace is named by the matched route pattern (e.g. /users/{id}) rather than the concrete path so
/// that traces of the same endpoint can be grouped.
public class TraceFinishHandler implements Handler {

    private final WebTraceExtraBuilder traceExtraBuilder;

    public TraceFinishHandler (WebTraceExtraBuilder traceExtraBuilder) {
        this.traceExtraBuilder = traceExtraBuilder;
    }

    @Override
    public void handle (Context ctx) {
        try {
            Trace.finish(endpointName(ctx), traceExtraBuilder.build(ctx));
        } finally {
            ErrorReporter.clearContext();
        }
    }

    /// When no endpoint matched (404/405) Javalin returns a human-readable sentence instead of a
    /// route pattern. Route patterns always start with a slash, so anything else means unmatched.
    static String endpointName (Context ctx) {
        String endpoint = ctx.endpointHandlerPath();
        if (endpoint == null || !endpoint.startsWith("/")) {
            return ctx.path();
        }
        return endpoint;
    }

}
