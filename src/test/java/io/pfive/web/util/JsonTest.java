// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.util;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class JsonTest {
    record Event (String eventName, LocalDate eventDate, String note) { }

    @Test
    void camel_case_iso_dates_no_nulls () throws Exception {
        String json = Json.camelCaseMapper.writeValueAsString(new Event("launch", LocalDate.of(2024, 3, 31), null));
        assertThat(json).isEqualTo("{\"eventName\":\"launch\",\"eventDate\":\"2024-03-31\"}");
    }

    @Test
    void unknown_properties_ignored () throws Exception {
        Event event = Json.camelCaseMapper.readValue(
            "{\"eventName\":\"launch\",\"eventDate\":\"2024-03-31\",\"extra\":1}", Event.class);
        assertThat(event).isEqualTo(new Event("launch", LocalDate.of(2024, 3, 31), null));
    }
}
