// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http;

import io.javalin.http.Context;

import java.util.Map;

/// Supplies application-specific fields to attach to the trace of each web request, for example
/// the ID of the authenticated user. Called from the after hook, once the response is known.
/// Configured with the "web.traceExtraBuilder" key as a class name.
public interface WebTraceExtraBuilder {

    /// @return extra trace fields, or null if there is nothing to add.
    Map<String, Object> build (Context context);

}
