// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.util;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;

/// Reflection helpers for turning a class found by name or by scanning into a usable instance.
public abstract class Instances {

    public static final String INSTANCE_FIELD = "INSTANCE";

    /// Stateless components are usually declared as singletons with a public static final INSTANCE
    /// field. Use that if present so we never create a second copy, otherwise call the no-argument
    /// constructor (which may be private).
    public static <T> T singletonOrNew (Class<T> type) {
        try {
            for (Field field : type.getDeclaredFields()) {
                int modifiers = field.getModifiers();
                if (INSTANCE_FIELD.equals(field.getName())
                        && Modifier.isStatic(modifiers)
                        && Modifier.isFinal(modifiers)
                        && type.isAssignableFrom(field.getType())) {
                    field.setAccessible(true);
                    Object value = field.get(null);
                    if (value != null) return type.cast(value);
                }
            }
            Constructor<T> constructor = type.getDeclaredConstructor();
            constructor.setAccessible(true);
            return constructor.newInstance();
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException(String.format(
                  "%s has neither an %s field nor a no-argument constructor.", type.getName(), INSTANCE_FIELD), e);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Could not obtain an instance of " + type.getName(), e);
        }
    }

}
