// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.guava.GuavaModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/// Shared Jackson configuration. ObjectMapper is threadsafe once configured, so one instance
/// serves both the Javalin JSON codec and direct body parsing in handlers.
public abstract class Json {

    // Module for Guava collection types like Multimaps, and one for java.time types which are
    // written as ISO-8601 strings instead of numeric timestamps.
    // Property names are left as declared in Java, which is camel case.
    public static final ObjectMapper camelCaseMapper = new ObjectMapper()
            .registerModule(new GuavaModule())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

}
