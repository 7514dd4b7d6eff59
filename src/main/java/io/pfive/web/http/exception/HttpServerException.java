// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http.exception;

/// Superclass for exceptions thrown from route handlers that represent an expected way for a
/// request to fail. Each one carries an ErrorType that is translated into an HTTP response code by
/// the exception handlers registered on every server, so handlers can bail out with a throw
/// instead of setting status codes and returning early.
public abstract class HttpServerException extends RuntimeException {
    public HttpServerException (String message) {
        super(message);
    }
    public abstract ErrorType errorType ();
    public enum ErrorType {
        REQUEST(400),
        // INTERNAL_SERVER(500), // Internal server errors should always be unexpected, so not created intentionally.
        FORBIDDEN(403),
        NOT_FOUND(404);
        public final int httpCode;
        ErrorType (int httpCode) {
            this.httpCode = httpCode;
        }
    }
}
