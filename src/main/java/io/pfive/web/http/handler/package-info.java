// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// This package contains the cross-cutting Javalin handlers registered on every server: the
/// before and after hooks around each request, and the exception handlers.
/// Javalin documentation on handlers: https://javalin.io/documentation#handlers
package io.pfive.web.http.handler;
