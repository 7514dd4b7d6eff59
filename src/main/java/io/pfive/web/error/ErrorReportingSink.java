// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.error;

/// Destination for unexpected errors, typically an external error tracking service.
/// Called on request threads, so implementations must be threadsafe.
public interface ErrorReportingSink {

    /// @param request details of the request being served when the error happened, or null if
    ///                the error did not happen while serving a request.
    void report (Throwable throwable, RequestDetails request);

}
