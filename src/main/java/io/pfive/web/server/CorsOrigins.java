// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.server;

import java.util.ArrayList;
import java.util.List;

/// The origins from the "web.corsOrigins" configuration key. The value is either a comma separated
/// list of origins like https://app.example.com, or "*" to allow any origin.
public record CorsOrigins (boolean anyHost, List<String> origins) {

    public static final String ANY_HOST = "*";

    public CorsOrigins {
        origins = List.copyOf(origins);
    }

    /// split() has weird edge cases for empty strings and trailing separators, so rather than
    /// repeating a stream idiom, spell out the conversion and skip blank entries.
    /// @return null if the value contains no origins at all, meaning CORS should not be enabled.
    public static CorsOrigins parse (String value) {
        if (value == null || value.isBlank()) return null;
        if (value.trim().equals(ANY_HOST)) return new CorsOrigins(true, List.of());
        List<String> origins = new ArrayList<>();
        for (String origin : value.split(",")) {
            if (!origin.isBlank()) {
                origins.add(origin.trim());
            }
        }
        if (origins.isEmpty()) return null;
        return new CorsOrigins(false, origins);
    }

    public String first () {
        return origins.get(0);
    }

    public String[] rest () {
        return origins.subList(1, origins.size()).toArray(new String[0]);
    }

}
