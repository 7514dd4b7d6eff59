// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.error;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ErrorReporterTest {
    private ErrorReportingSink sink;

    @BeforeEach
    void install () {
        sink = mock(ErrorReportingSink.class);
        ErrorReporter.useSink(sink);
    }

    @AfterEach
    void restore () {
        ErrorReporter.clearContext();
        ErrorReporter.useSink(new LoggingErrorReportingSink());
    }

    @Test
    void reports_with_request_context () {
        RequestDetails request = new RequestDetails("POST", "http://localhost/orders", "127.0.0.1");
        ErrorReporter.setContext(request);
        assertThat(ErrorReporter.context()).isSameAs(request);
        RuntimeException error = new RuntimeException("failed");
        ErrorReporter.report(error);
        verify(sink).report(error, request);
    }

    @Test
    void reports_without_context () {
        RuntimeException error = new RuntimeException("failed");
        ErrorReporter.report(error);
        verify(sink).report(error, null);
        assertThat(ErrorReporter.context()).isNull();
    }

    @Test
    void failing_sink_does_not_throw () {
        doThrow(new IllegalStateException("sink down")).when(sink).report(any(), any());
        ErrorReporter.report(new RuntimeException("failed"));
        verify(sink).report(any(), any());
    }

    @Test
    void brief_messages () {
        assertThat(ErrorReporter.briefThrowableMessage(new IllegalStateException("bad state")))
            .isEqualTo("IllegalStateException: bad state");
        assertThat(ErrorReporter.briefThrowableMessage(new NullPointerException()))
            .isEqualTo("NullPointerException");
        assertThat(ErrorReporter.stackTrace(new IllegalStateException("bad state")))
            .startsWith("java.lang.IllegalStateException: bad state")
            .contains("ErrorReporterTest");
    }

    @Test
    void request_details_summary () {
        assertThat(new RequestDetails("GET", "http://localhost/x", "10.0.0.1"))
            .hasToString("GET http://localhost/x from 10.0.0.1");
    }
}
