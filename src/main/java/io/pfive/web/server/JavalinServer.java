// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.web.server;

import io.javalin.Javalin;
import io.javalin.config.JavalinConfig;
import io.javalin.json.JavalinJackson;
import io.javalin.openapi.BearerAuth;
import io.javalin.openapi.plugin.OpenApiPlugin;
import io.javalin.openapi.plugin.SecurityComponentConfiguration;
import io.javalin.openapi.plugin.swagger.SwaggerPlugin;
import io.javalin.testtools.JavalinTest;
import io.javalin.testtools.TestCase;
import io.pfive.web.Configuration;
import io.pfive.web.Environment;
import io.pfive.web.http.EmptyWebTraceExtraBuilder;
import io.pfive.web.http.WebTraceExtraBuilder;
import io.pfive.web.http.handler.ExceptionHandlers;
import io.pfive.web.http.handler.SessionTraceHandler;
import io.pfive.web.http.handler.TraceFinishHandler;
import io.pfive.web.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.function.Consumer;

/// Base class for an application's web server, which wraps a Javalin instance configured in a
/// standard way. An application declares one subclass, adding its own configuration such as
/// routes:
///
/// ```
/// public class WebServer extends JavalinServer {
///     public static final WebServer INSTANCE = new WebServer();
///     private WebServer () {
///         super(config -> config.router.apiBuilder(() -> {
///             get("/myPath", myHandler);
///             Routers.discoverRelativeTo(WebServer.class).forEach(Router::route);
///         }));
///     }
/// }
///
/// WebServer.INSTANCE.start();
/// ```
///
/// Routers.discoverRelativeTo() finds every Router in the same package as the server class or any
/// package below it, so many applications need no other setup. The Javalin instance is available
/// from app().
///
/// The following configuration keys are used:
/// - web.openApi: if true, the root of the API serves Swagger UI and /openapi serves the OpenAPI
///   JSON. Default true.
/// - web.allowOpenApiInProd: if true, Swagger is served in production as well. Default false.
/// - web.traceExtraBuilder: class name of a WebTraceExtraBuilder adding info to web request traces.
/// - web.corsOrigins: comma separated list of origins CORS should be enabled for, or * for all.
/// - web.serverPort: the port the web server listens on. Default 8080.
public abstract class JavalinServer {

    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String OPEN_API_KEY = "web.openApi";
    public static final String ALLOW_OPEN_API_IN_PROD_KEY = "web.allowOpenApiInProd";
    public static final String TRACE_EXTRA_BUILDER_KEY = "web.traceExtraBuilder";
    public static final String CORS_ORIGINS_KEY = "web.corsOrigins";
    public static final String SERVER_PORT_KEY = "web.serverPort";

    public static final int DEFAULT_PORT = 8080;
    public static final String SWAGGER_UI_PATH = "/";
    public static final String BEARER_AUTH_SCHEME = "BearerAuth";

    private final Consumer<JavalinConfig> setup;
    private final Environment environment;
    private final boolean useOpenApi;
    private final boolean allowOpenApiInProd;
    private final WebTraceExtraBuilder traceExtraBuilder;
    private final CorsOrigins corsOrigins;
    private final int port;

    private Javalin currentApp;

    protected JavalinServer (Consumer<JavalinConfig> setup) {
        this(Configuration.global(), setup);
    }

    protected JavalinServer () {
        this(config -> { });
    }

    protected JavalinServer (Configuration configuration, Consumer<JavalinConfig> setup) {
        this.setup = setup;
        this.environment = configuration.environment();
        this.useOpenApi = configuration.boolVal(OPEN_API_KEY, true);
        this.allowOpenApiInProd = configuration.boolVal(ALLOW_OPEN_API_IN_PROD_KEY, false);
        this.traceExtraBuilder = configuration.instanceVal(
                TRACE_EXTRA_BUILDER_KEY, WebTraceExtraBuilder.class, EmptyWebTraceExtraBuilder.INSTANCE);
        this.corsOrigins = CorsOrigins.parse(configuration.stringValOrNull(CORS_ORIGINS_KEY));
        this.port = configuration.intVal(SERVER_PORT_KEY, DEFAULT_PORT);
    }

    /// Created on first access. This is a plain null check rather than synchronized or
    /// double-checked locking, as the server is created once during single-threaded startup.
    public Javalin app () {
        if (currentApp == null) {
            currentApp = create();
        }
        return currentApp;
    }

    public void start () {
        LOG.info("Starting {} on port {}.", environment, port);
        app().start(port);
    }

    public void stop () {
        if (currentApp != null) {
            currentApp.stop();
        }
    }

    /// Run a test case against a newly created app (not the one returned by app()) listening on a
    /// random port. The app is stopped when the test case returns.
    public void test (TestCase testCase) {
        JavalinTest.test(create(), testCase);
    }

    public int port () {
        return port;
    }

    public Environment environment () {
        return environment;
    }

    /// Registration order: CORS, JSON mapper, OpenAPI and Swagger, the application's setup, then
    /// exception handlers and the before and after hooks.
    Javalin create () {
        Javalin app = Javalin.create(config -> {
            if (corsOrigins != null) {
                config.bundledPlugins.enableCors(cors -> cors.addRule(rule -> {
                    if (corsOrigins.anyHost()) {
                        rule.anyHost();
                    } else {
                        rule.allowHost(corsOrigins.first(), corsOrigins.rest());
                    }
                }));
            }

            config.jsonMapper(new JavalinJackson(Json.camelCaseMapper, false));

            if (openApiEnabled()) {
                config.registerPlugin(new OpenApiPlugin(openApiConfig ->
                    openApiConfig.withDefinitionConfiguration((version, definition) -> definition
                        .withInfo(openApiInfo -> {
                            openApiInfo.setTitle(environment.applicationName);
                            openApiInfo.setVersion(environment.version);
                        })
                        .withSecurity(new SecurityComponentConfiguration()
                            .withSecurityScheme(BEARER_AUTH_SCHEME, new BearerAuth())))
                ));
                config.registerPlugin(new SwaggerPlugin(swaggerConfig -> swaggerConfig.setUiPath(SWAGGER_UI_PATH)));
            }

            setup.accept(config);
        });

        ExceptionHandlers.register(app);
        app.before(new SessionTraceHandler(environment.isNotLocal()));
        app.after(new TraceFinishHandler(traceExtraBuilder));
        return app;
    }

    boolean openApiEnabled () {
        return useOpenApi && (allowOpenApiInProd || environment.isNotProd());
    }

}
