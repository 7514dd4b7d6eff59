// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.trace;

/// Receives every completed trace. This is the seam for forwarding traces to an external
/// observability service. Implementations are called on request threads and must be threadsafe.
public interface TraceSink {
    void accept (CompletedTrace trace);
}
