// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http;

import io.javalin.http.Context;

import java.util.Map;

public class EmptyWebTraceExtraBuilder implements WebTraceExtraBuilder {

    public static final EmptyWebTraceExtraBuilder INSTANCE = new EmptyWebTraceExtraBuilder();

    private EmptyWebTraceExtraBuilder () { }

    @Override
    public Map<String, Object> build (Context context) {
        return null;
    }
}
