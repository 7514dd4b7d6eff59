// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/// Default sink when no error tracking service is configured. The stack trace has already been
/// logged where the error was caught, so only a one-line summary is written here.
public class LoggingErrorReportingSink implements ErrorReportingSink {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    @Override
    public void report (Throwable throwable, RequestDetails request) {
        if (request == null) {
            LOG.error("Reported error: {}", ErrorReporter.briefThrowableMessage(throwable));
        } else {
            LOG.error("Reported error in {}: {}", request, ErrorReporter.briefThrowableMessage(throwable));
        }
    }
}
