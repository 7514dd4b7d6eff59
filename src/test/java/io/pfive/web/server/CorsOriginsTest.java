// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.server;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CorsOriginsTest {
    @Test
    void absent_means_disabled () {
        assertThat(CorsOrigins.parse(null)).isNull();
        assertThat(CorsOrigins.parse("  ")).isNull();
        assertThat(CorsOrigins.parse(" , ,")).isNull();
    }

    @Test
    void wildcard () {
        CorsOrigins origins = CorsOrigins.parse(" * ");
        assertThat(origins.anyHost()).isTrue();
        assertThat(origins.origins()).isEmpty();
    }

    @Test
    void single_origin () {
        CorsOrigins origins = CorsOrigins.parse("https://a.example.com");
        assertThat(origins.anyHost()).isFalse();
        assertThat(origins.first()).isEqualTo("https://a.example.com");
        assertThat(origins.rest()).isEmpty();
    }

    @Test
    void several_origins_trimmed () {
        CorsOrigins origins = CorsOrigins.parse("https://a.example.com, https://b.example.com,,http://localhost:3000 ");
        assertThat(origins.origins())
            .isEqualTo(List.of("https://a.example.com", "https://b.example.com", "http://localhost:3000"));
        assertThat(origins.first()).isEqualTo("https://a.example.com");
        assertThat(origins.rest()).containsExactly("https://b.example.com", "http://localhost:3000");
    }
}
