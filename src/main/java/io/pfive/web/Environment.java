// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web;

import java.util.Locale;

/// Where the process is running and what it is. The environment name comes from the "environment"
/// configuration key and defaults to local, so a developer machine needs no configuration at all.
public class Environment {

    public static final String LOCAL = "local";
    public static final String PROD = "prod";

    public final String name;
    public final String applicationName;
    public final String version;

    Environment (Configuration configuration) {
        this.name = configuration.stringVal(Configuration.ENVIRONMENT_KEY, LOCAL).toLowerCase(Locale.ROOT);
        this.applicationName = configuration.stringVal("app.name", "web");
        this.version = configuration.stringVal("app.version", "0.0.0");
    }

    /// Both "prod" and "production" are accepted.
    public boolean isProd () {
        return PROD.equals(name) || "production".equals(name);
    }

    public boolean isNotProd () {
        return !isProd();
    }

    public boolean isLocal () {
        return LOCAL.equals(name);
    }

    public boolean isNotLocal () {
        return !isLocal();
    }

    @Override
    public String toString () {
        return String.format("%s %s (%s)", applicationName, version, name);
    }
}
