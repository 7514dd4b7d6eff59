// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.util;

/// Wall-clock timer started on construction. Trace durations only need millisecond resolution.
public class MilliTimer {
    private final long startTime = System.currentTimeMillis();

    public long getStartMillis () {
        return startTime;
    }

    public long getElapsedMillis () {
        return System.currentTimeMillis() - startTime;
    }
}
