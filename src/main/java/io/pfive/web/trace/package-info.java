// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Request-scoped tracing. A trace is started and finished by the web server hooks around every
/// request and carries the session ID, timing, and any extra fields the application adds.
package io.pfive.web.trace;
