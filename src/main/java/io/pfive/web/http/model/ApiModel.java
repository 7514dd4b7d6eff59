// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.http.model;

/// Group together simple HTTP API response types used only for structuring JSON responses.
public abstract class ApiModel {

    /// One problem with a request input. The field is the name of a body property, path parameter
    /// or query parameter.
    public record ValidationError (String field, String message) { }

}
