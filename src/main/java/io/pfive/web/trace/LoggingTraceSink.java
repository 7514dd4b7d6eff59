// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

public class LoggingTraceSink implements TraceSink {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    @Override
    public void accept (CompletedTrace trace) {
        LOG.debug("{} {} ({}) took {} ms, session {} {}",
                trace.type(), trace.finishName(), trace.startName(),
                trace.durationMillis(), trace.sessionId(), trace.extra());
    }
}
