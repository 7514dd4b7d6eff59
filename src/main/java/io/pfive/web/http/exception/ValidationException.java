// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http.exception;

import io.pfive.web.http.model.ApiModel.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/// Throw this to bail out of the request and respond with a "400 Bad Request" code. The body of
/// the response is the JSON list of validation errors, so clients can show them next to the
/// offending fields.
public class ValidationException extends HttpServerException {

    private final List<ValidationError> validationErrors;

    public ValidationException (List<ValidationError> validationErrors) {
        super("Validation failed: " + describe(validationErrors));
        this.validationErrors = List.copyOf(validationErrors);
    }

    public ValidationException (String field, String message) {
        this(List.of(new ValidationError(field, message)));
    }

    public List<ValidationError> validationErrors () {
        return validationErrors;
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.REQUEST;
    }

    private static String describe (List<ValidationError> errors) {
        return errors.stream()
                .map(e -> e.field() + " " + e.message())
                .collect(Collectors.joining("; "));
    }
}
