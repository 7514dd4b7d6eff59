// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http.exception;

public class NotFoundException extends HttpServerException {
    public NotFoundException (String message) {
        super("Not found: " + message);
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.NOT_FOUND;
    }
}
