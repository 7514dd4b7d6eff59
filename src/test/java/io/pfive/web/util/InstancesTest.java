// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InstancesTest {
    static class Singleton {
        static final Singleton INSTANCE = new Singleton();
        private Singleton () { }
    }

    static class Plain {
        private Plain () { }
    }

    static class NotFinal {
        static NotFinal INSTANCE = new NotFinal();
    }

    static class NeedsArgument {
        NeedsArgument (String arg) { }
    }

    static class Failing {
        Failing () {
            throw new IllegalArgumentException("nope");
        }
    }

    @Test
    void uses_instance_field () {
        assertThat(Instances.singletonOrNew(Singleton.class)).isSameAs(Singleton.INSTANCE);
    }

    @Test
    void constructs_otherwise () {
        assertThat(Instances.singletonOrNew(Plain.class))
            .isInstanceOf(Plain.class)
            .isNotSameAs(Instances.singletonOrNew(Plain.class));
        assertThat(Instances.singletonOrNew(NotFinal.class)).isNotSameAs(NotFinal.INSTANCE);
    }

    @Test
    void failures_name_the_class () {
        assertThatThrownBy(() -> Instances.singletonOrNew(NeedsArgument.class))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(NeedsArgument.class.getName());
        assertThatThrownBy(() -> Instances.singletonOrNew(Failing.class))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(Failing.class.getName());
    }
}
