// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.testapp;

import io.pfive.web.http.Contexts;
import io.pfive.web.http.exception.NotFoundException;
import io.pfive.web.http.exception.UnauthorizedException;
import io.pfive.web.http.exception.ValidationException;
import io.pfive.web.server.Router;
import io.pfive.web.trace.Trace;

import java.util.Map;

import static io.javalin.apibuilder.ApiBuilder.get;

/// Discovered through its no-argument constructor.
public class SampleRoutes implements Router {

    @Override
    public void route () {
        get("/2", ctx -> ctx.result("From2"));
        get("/session", ctx -> ctx.result(String.valueOf(Trace.current().sessionId())));
        get("/items/{id}", ctx -> ctx.json(Map.of("id", Contexts.idPathParam(ctx))));
        get("/validation", ctx -> {
            throw new ValidationException("name", "must not be blank");
        });
        get("/forbidden", ctx -> {
            throw new UnauthorizedException();
        });
        get("/missing", ctx -> {
            throw new NotFoundException("no such thing");
        });
        get("/boom", ctx -> {
            throw new IllegalStateException("boom");
        });
    }

}
