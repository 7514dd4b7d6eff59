// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http;

import com.fasterxml.jackson.core.type.TypeReference;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import io.pfive.web.http.exception.ValidationException;
import io.pfive.web.util.Json;
import io.pfive.web.util.RandomId;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/// Static utility methods for reading typed values out of a Javalin Context in route handlers.
/// A value that is present but cannot be parsed is the client's fault, so it raises a
/// ValidationException naming the parameter, which the server turns into a 400 response.
/// Absent query parameters are returned as null.
public abstract class Contexts {

    public static final String DEFAULT_ID_PARAM = "id";

    public static UUID idPathParam (Context ctx) {
        return idPathParam(ctx, DEFAULT_ID_PARAM);
    }

    public static UUID idPathParam (Context ctx, String name) {
        String value = ctx.pathParam(name);
        UUID id = RandomId.parseUuidOrNull(value);
        if (id == null) {
            throw new ValidationException(name, "must be a UUID");
        }
        return id;
    }

    public static Integer intQueryParam (Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name, "must be an integer");
        }
    }

    public static Long longQueryParam (Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null) return null;
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(name, "must be an integer");
        }
    }

    /// Dates are expected in ISO-8601 format, e.g. 2024-03-31.
    public static LocalDate dateQueryParam (Context ctx, String name) {
        String value = ctx.queryParam(name);
        if (value == null) return null;
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(name, "must be a date in the form YYYY-MM-DD");
        }
    }

    /// Respond with the object serialized as JSON, or with an empty 404 response if it is null.
    /// Convenient for lookups by ID.
    public static Context jsonOr404 (Context ctx, Object object) {
        if (object == null) {
            return ctx.status(HttpStatus.NOT_FOUND);
        }
        return ctx.json(object);
    }

    /// Deserialize the raw request body with the shared mapper. Unlike ctx.bodyAsClass() this
    /// does not depend on which JSON mapper the server was configured with, and reports
    /// malformed bodies as validation errors.
    public static <T> T bodyFromJson (Context ctx, Class<T> type) {
        try {
            return Json.camelCaseMapper.readValue(ctx.bodyAsBytes(), type);
        } catch (IOException e) {
            throw new ValidationException("body", "should be a JSON representation of " + type.getSimpleName());
        }
    }

    public static <T> T bodyFromJson (Context ctx, TypeReference<T> type) {
        try {
            return Json.camelCaseMapper.readValue(ctx.bodyAsBytes(), type);
        } catch (IOException e) {
            throw new ValidationException("body", "should be a JSON representation of " + type.getType().getTypeName());
        }
    }

}
