// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web;

import io.pfive.web.http.EmptyWebTraceExtraBuilder;
import io.pfive.web.http.WebTraceExtraBuilder;
import io.pfive.web.trace.LoggingTraceSink;
import io.pfive.web.trace.TraceSink;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigurationTest {
    private static Configuration of (String... keysAndValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            properties.setProperty(keysAndValues[i], keysAndValues[i + 1]);
        }
        return Configuration.fromProperties(properties);
    }

    @Test
    void defaults_when_missing_or_blank () {
        Configuration config = of("blank", "  ");
        assertThat(config.intVal("missing", 8080)).isEqualTo(8080);
        assertThat(config.boolVal("blank", true)).isTrue();
        assertThat(config.stringVal("missing", "x")).isEqualTo("x");
        assertThat(config.stringValOrNull("blank")).isNull();
        assertThat(config.contains("blank")).isFalse();
        assertThatThrownBy(() -> config.stringVal("missing"))
            .hasMessage("Missing configuration key: missing");
    }

    @Test
    void values_are_trimmed () {
        Configuration config = of("port", " 9090 ", "name", " api ");
        assertThat(config.intVal("port", 0)).isEqualTo(9090);
        assertThat(config.stringVal("name")).isEqualTo("api");
    }

    @Test
    void booleans () {
        Configuration config = of("a", "TRUE", "b", "yes", "c", "False", "d", "no", "e", "maybe");
        assertThat(config.boolVal("a", false)).isTrue();
        assertThat(config.boolVal("b", false)).isTrue();
        assertThat(config.boolVal("c", true)).isFalse();
        assertThat(config.boolVal("d", true)).isFalse();
        assertThatThrownBy(() -> config.boolVal("e", false))
            .hasMessageContaining("'maybe'")
            .hasMessageContaining("'e'");
    }

    @Test
    void bad_integer () {
        assertThatThrownBy(() -> of("port", "eighty").intVal("port", 8080))
            .hasMessageContaining("'eighty'")
            .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void instances_by_class_name () {
        Configuration config = of(
            "singleton", EmptyWebTraceExtraBuilder.class.getName(),
            "constructed", LoggingTraceSink.class.getName(),
            "wrongType", String.class.getName(),
            "unknown", "io.pfive.NoSuchClass");
        assertThat(config.instanceVal("singleton", WebTraceExtraBuilder.class, null))
            .isSameAs(EmptyWebTraceExtraBuilder.INSTANCE);
        assertThat(config.instanceVal("constructed", TraceSink.class, null))
            .isInstanceOf(LoggingTraceSink.class);
        assertThat(config.instanceVal("missing", TraceSink.class, null)).isNull();
        assertThatThrownBy(() -> config.instanceVal("wrongType", TraceSink.class, null))
            .hasMessageContaining("is not a TraceSink");
        assertThatThrownBy(() -> config.instanceVal("unknown", TraceSink.class, null))
            .hasCauseInstanceOf(ClassNotFoundException.class);
    }

    @Test
    void environment () {
        Environment local = of().environment();
        assertThat(local.isLocal()).isTrue();
        assertThat(local.isNotProd()).isTrue();
        assertThat(local.applicationName).isEqualTo("web");

        Environment prod = of("environment", "Production", "app.name", "api", "app.version", "2.0").environment();
        assertThat(prod.isProd()).isTrue();
        assertThat(prod.isNotLocal()).isTrue();
        assertThat(prod.toString()).isEqualTo("api 2.0 (production)");
    }

    @Test
    void load_overlays_environment_file () {
        Configuration config = Configuration.load();
        assertThat(config.environment().name).isEqualTo("test");
        assertThat(config.environment().applicationName).isEqualTo("web-test");
        // From application-test.properties.
        assertThat(config.environment().version).isEqualTo("1.2.3");
    }

    @Test
    void system_properties_override_files () {
        System.setProperty("app.name", "overridden");
        try {
            assertThat(Configuration.load().environment().applicationName).isEqualTo("overridden");
        } finally {
            System.clearProperty("app.name");
        }
    }
}
