// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http.exception;

/// The caller is known (or anonymous) but is not allowed to do what was asked. This maps to 403
/// rather than 401, since authentication itself is handled outside this layer.
public class UnauthorizedException extends HttpServerException {
    public UnauthorizedException (String message) {
        super("Unauthorized: " + message);
    }

    public UnauthorizedException () {
        this("access denied");
    }

    @Override
    public ErrorType errorType () {
        return ErrorType.FORBIDDEN;
    }

}
