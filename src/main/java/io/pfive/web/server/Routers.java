// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.server;

import com.google.common.reflect.ClassPath;
import io.pfive.web.util.Instances;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/// Finds the Router implementations in the codebase so applications don't have to list them.
public abstract class Routers {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /// Find all concrete top-level classes implementing Router in the package of the anchor class
    /// or any package below it, and return one instance of each. Classes are loaded but not
    /// initialized while scanning, so unrelated classes in those packages have no side effects.
    /// Instances are ordered by class name so routes are always registered in the same order.
    ///
    /// A class that fails to load (for example one referring to a library missing at runtime) is
    /// logged and skipped, since it can't be a usable Router anyway.
    ///
    /// @param anchor usually the server class itself, placed at the root of the application's packages.
    public static List<Router> discoverRelativeTo (Class<?> anchor) {
        checkNotNull(anchor);
        String packageName = anchor.getPackageName();
        ClassLoader classLoader = anchor.getClassLoader();
        List<Class<? extends Router>> routerClasses = new ArrayList<>();
        try {
            for (ClassPath.ClassInfo classInfo : ClassPath.from(classLoader).getTopLevelClassesRecursive(packageName)) {
                Class<?> clazz = loadOrNull(classLoader, classInfo.getName());
                if (clazz == null || clazz.equals(anchor) || !isConcreteRouter(clazz)) continue;
                routerClasses.add(clazz.asSubclass(Router.class));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not scan class path for routers in package " + packageName, e);
        }
        routerClasses.sort(Comparator.comparing(Class::getName));
        List<Router> routers = new ArrayList<>(routerClasses.size());
        for (Class<? extends Router> routerClass : routerClasses) {
            routers.add(Instances.singletonOrNew(routerClass));
        }
        LOG.info("Discovered {} routers under package {}.", routers.size(), packageName);
        return routers;
    }

    static Class<?> loadOrNull (ClassLoader classLoader, String className) {
        try {
            return classLoader.loadClass(className);
        } catch (ClassNotFoundException | LinkageError e) {
            LOG.warn("Skipping class {} while discovering routers: {}", className, e.toString());
            return null;
        }
    }

    static boolean isConcreteRouter (Class<?> clazz) {
        return Router.class.isAssignableFrom(clazz)
                && !clazz.isInterface()
                && !Modifier.isAbstract(clazz.getModifiers());
    }

}
