// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// Helpers for application route handlers, and the extension point for adding fields to
/// web request traces.
package io.pfive.web.http;
