// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.server;

/// Registers a group of related routes. Implementations are found automatically by
/// Routers.discoverRelativeTo() and their route() method is called inside
/// config.router.apiBuilder(), so they register handlers with the static ApiBuilder methods:
///
/// ```
/// public class UserRoutes implements Router {
///     public void route () {
///         get("/users/{id}", ctx -> ...);
///     }
/// }
/// ```
public interface Router {
    void route ();
}
