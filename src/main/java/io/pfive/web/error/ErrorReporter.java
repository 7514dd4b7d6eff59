// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.error;

import io.pfive.web.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.invoke.MethodHandles;

/// Static facade for reporting unexpected errors. The web server records details of the request
/// being served on each thread, so reports made from anywhere during that request include them.
/// Unless a sink is installed with useSink(), it is read from the "errors.reportingSink"
/// configuration key, falling back to logging.
public abstract class ErrorReporter {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String SINK_KEY = "errors.reportingSink";

    private static final ThreadLocal<RequestDetails> CONTEXT = new ThreadLocal<>();

    private static volatile ErrorReportingSink sink;

    public static void setContext (RequestDetails requestDetails) {
        CONTEXT.set(requestDetails);
    }

    public static RequestDetails context () {
        return CONTEXT.get();
    }

    public static void clearContext () {
        CONTEXT.remove();
    }

    /// A failing sink must never replace the original error, so its own exceptions are logged and
    /// dropped here.
    public static void report (Throwable throwable) {
        try {
            sink().report(throwable, CONTEXT.get());
        } catch (RuntimeException e) {
            LOG.error("Error reporting sink failed while reporting {}.", briefThrowableMessage(throwable), e);
        }
    }

    public static ErrorReportingSink sink () {
        ErrorReportingSink result = sink;
        if (result == null) {
            result = Configuration.global().instanceVal(SINK_KEY, ErrorReportingSink.class, new LoggingErrorReportingSink());
            sink = result;
        }
        return result;
    }

    public static void useSink (ErrorReportingSink errorReportingSink) {
        sink = errorReportingSink;
    }

    public static String stackTrace (Throwable throwable) {
        StringWriter stringWriter = new StringWriter();
        PrintWriter printWriter = new PrintWriter(stringWriter);
        throwable.printStackTrace(printWriter);
        return stringWriter.toString();
    }

    /// Create a one-line message consisting of only the exception class name and its message (if
    /// any). Some exceptions may be constructed with no message so getMessage returns null.
    public static String briefThrowableMessage (Throwable throwable) {
        String message = throwable.getMessage();
        String className = throwable.getClass().getSimpleName();
        if (message == null) {
            return className;
        } else {
            return className + ": " + message;
        }
    }

}
