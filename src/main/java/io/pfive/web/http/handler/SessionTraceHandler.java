// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http.handler;

import io.javalin.http.Context;
import io.javalin.http.Cookie;
import io.javalin.http.Handler;
import io.pfive.web.error.ErrorReporter;
import io.pfive.web.error.RequestDetails;
import io.pfive.web.trace.Trace;
import io.pfive.web.util.RandomId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.Map;
import java.util.UUID;

/// Before hook run for every request. Records the request for error reports, identifies the
/// browser session with a cookie (issuing a new one when the request has none) and starts the
/// request trace carrying that session ID.
public class SessionTraceHandler implements Handler {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String SESSION_COOKIE = "ktlibSessionId";
    public static final String TRACE_TYPE = "Web";

    private final boolean secureCookie;

    /// @param secureCookie whether the session cookie may only be sent over HTTPS. Local
    ///                     development servers usually run without TLS.
    public SessionTraceHandler (boolean secureCookie) {
        this.secureCookie = secureCookie;
    }

    @Override
    public void handle (Context ctx) {
        ErrorReporter.setContext(new RequestDetails(ctx.method().name(), ctx.url(), ctx.ip()));
        Trace.clear();
        UUID sessionId = RandomId.parseUuidOrNull(ctx.cookie(SESSION_COOKIE));
        if (sessionId == null) {
            sessionId = RandomId.createSessionId();
            Cookie cookie = new Cookie(SESSION_COOKIE, sessionId.toString());
            cookie.setHttpOnly(true);
            cookie.setSecure(secureCookie);
            ctx.cookie(cookie);
            LOG.debug("Issued new session {} to {}.", sessionId, ctx.ip());
        }
        Trace.sessionId(sessionId);
        Trace.start(TRACE_TYPE, ctx.path(), Map.of("url", ctx.path()));
    }

}
