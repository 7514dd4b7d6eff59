// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

/// This is the data model for the HTTP API produced by this layer itself, as opposed to the
/// models of applications built on it. These types are only serialized, never read back.
package io.pfive.web.http.model;
