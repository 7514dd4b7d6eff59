// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.error;

/// The parts of an HTTP request worth attaching to an error report.
public record RequestDetails (String method, String url, String clientIp) {
    @Override
    public String toString () {
        return method + " " + url + " from " + clientIp;
    }
}
