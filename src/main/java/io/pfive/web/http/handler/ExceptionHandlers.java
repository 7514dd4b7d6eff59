// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http.handler;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.pfive.web.error.ErrorReporter;
import io.pfive.web.http.exception.HttpServerException;
import io.pfive.web.http.exception.NotFoundException;
import io.pfive.web.http.exception.UnauthorizedException;
import io.pfive.web.http.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/// Exception handlers converting exceptions thrown by route handlers into response codes. This
/// allows bailing out of simple checks without yielding a general-purpose 500 response, and
/// avoids chains of conditional returns passing error objects back up the stack.
///
/// Javalin picks the handler registered for the closest superclass of the thrown exception, so the
/// catch-all for Exception only sees what the specific handlers don't. Javalin's own
/// HttpResponseExceptions (such as the 404 for an unknown path) keep their built-in handling.
public abstract class ExceptionHandlers {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static void register (Javalin app) {
        app.exception(ValidationException.class, (e, ctx) -> {
            ctx.json(e.validationErrors());
            respondExpected(e, ctx);
        });
        app.exception(UnauthorizedException.class, ExceptionHandlers::respondExpected);
        app.exception(NotFoundException.class, ExceptionHandlers::respondExpected);
        app.exception(Exception.class, ExceptionHandlers::respondUnexpected);
    }

    /// These errors are expected in normal operation, so don't log stack traces.
    private static void respondExpected (HttpServerException e, Context ctx) {
        LOG.debug("{} {} failed: {}", ctx.method(), ctx.path(), e.getMessage());
        ctx.status(e.errorType().httpCode);
    }

    /// Unexpected errors are not associated with HTTP codes. Log the whole stack trace and pass
    /// the error on to the reporter, but don't reveal any details to the client.
    private static void respondUnexpected (Exception e, Context ctx) {
        LOG.error("Unhandled exception serving {} {}: \n{}", ctx.method(), ctx.path(), ErrorReporter.stackTrace(e));
        ErrorReporter.report(e);
        ctx.status(HttpStatus.INTERNAL_SERVER_ERROR);
    }

}
