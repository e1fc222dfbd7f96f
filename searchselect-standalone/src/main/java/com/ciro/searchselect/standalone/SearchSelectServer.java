package com.ciro.searchselect.standalone;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import io.undertow.server.handlers.resource.ClassPathResourceManager;
import io.undertow.server.handlers.resource.ResourceHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host HTTP de los widgets: página, /intent/* y el runtime JS.
 */
public class SearchSelectServer {

    private static final Logger log = LoggerFactory.getLogger(SearchSelectServer.class);

    private final StandaloneConfig config;
    private final WidgetRegistry registry;
    private final ObjectMapper mapper;
    private final StandaloneSessionManager sessionManager;
    private final WidgetStore store;
    private final IntentGuard guard;
    private final SelectHttpApi api;

    private String title = "SearchSelect Standalone";
    private Undertow server;

    public SearchSelectServer(StandaloneConfig config) {
        this.config = config;
        this.registry = new WidgetRegistry();
        this.mapper = ObjectMapperFactory.create();
        this.store = new WidgetStore(config);
        // fin de sesión -> fuera todos sus widgets
        this.sessionManager = new StandaloneSessionManager(config.getSessionTtlMinutes(), store::removeSession);
        this.guard = new IntentGuard(config.getIntentsPerSecond(), mapper);
        this.api = new SelectHttpApi(registry, store, guard, mapper);
    }

    public SearchSelectServer addWidget(WidgetDefinition<?> def) {
        registry.add(def);
        return this;
    }

    public SearchSelectServer title(String title) {
        this.title = title;
        return this;
    }

    public synchronized void start() {
        if (server != null) throw new IllegalStateException("El servidor ya está arrancado");

        ClassLoader cl = SearchSelectServer.class.getClassLoader();

        // /js/* -> classpath:/static/js/*
        ResourceHandler jsHandler = new ResourceHandler(new ClassPathResourceManager(cl, "static/js"));
        jsHandler.setCacheTime(0);

        IntentEndpoint intentEndpoint = new IntentEndpoint(api, guard, mapper, sessionManager);
        PageEndpoint pageEndpoint = new PageEndpoint(registry, api, sessionManager, title);

        // lo que no matchea ningún prefix cae en la página
        HttpHandler fallback = pageEndpoint;
        PathHandler routes = new PathHandler(fallback);
        routes.addPrefixPath("/intent", intentEndpoint);
        routes.addPrefixPath("/js", jsHandler);

        server = Undertow.builder()
                .addHttpListener(config.getPort(), config.getHost())
                .setHandler(routes)
                .build();
        server.start();

        log.info("SearchSelect Standalone corriendo en http://localhost:{} ({} widgets)",
                config.getPort(), registry.all().size());
        log.debug("Config: {}", config);
    }

    public synchronized void stop() {
        if (server == null) return;
        server.stop();
        server = null;
        log.info("SearchSelect Standalone detenido");
    }
}
