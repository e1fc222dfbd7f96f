package com.ciro.searchselect.standalone;

import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.jsoup.nodes.Entities;

/**
 * GET / : página completa con todos los widgets registrados, en el estado
 * que tenga la sesión.
 */
public class PageEndpoint implements HttpHandler {

    private final WidgetRegistry registry;
    private final SelectHttpApi api;
    private final StandaloneSessionManager sessionManager;
    private final String title;

    public PageEndpoint(WidgetRegistry registry,
                        SelectHttpApi api,
                        StandaloneSessionManager sessionManager,
                        String title) {
        this.registry = registry;
        this.api = api;
        this.sessionManager = sessionManager;
        this.title = title;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {

        String requestPath = exchange.getRequestPath();
        if (requestPath == null || requestPath.isBlank()) requestPath = "/";

        if (!"/".equals(requestPath)) {
            exchange.setStatusCode(404);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=UTF-8");
            exchange.getResponseSender().send("404 Not Found: " + requestPath);
            return;
        }

        String sid = sessionManager.ensureSession(exchange);
        sessionManager.touchNoCache(exchange);

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/html; charset=UTF-8");
        exchange.getResponseSender().send(page(sid));
    }

    String page(String sid) {
        StringBuilder widgets = new StringBuilder();
        for (WidgetDefinition<?> def : registry.all()) {
            widgets.append("<section class=\"field\">")
                   .append(api.render(sid, def.id()))
                   .append("</section>");
        }

        return """
            <!DOCTYPE html>
            <html>
            <head>
                <meta charset="UTF-8">
                <meta name="viewport" content="width=device-width, initial-scale=1">
                <title>%s</title>
                <script src="/js/searchselect-runtime.js" defer></script>
                <style>
                    body { margin:0; padding:40px; font-family: system-ui, -apple-system, Segoe UI, sans-serif; }
                    .field { margin-bottom: 24px; max-width: 320px; }
                    .searchselect-value { border:1px solid #ccc; padding:8px; cursor:pointer; display:flex; gap:8px; }
                    .searchselect-label { flex:1; }
                    .searchselect.closed .searchselect-dropdown { display:none; }
                    .searchselect-label.placeholder { color:#999; }
                    .searchselect-options { list-style:none; margin:0; padding:0; border:1px solid #ccc; border-top:none; }
                    .searchselect-option { padding:6px 8px; cursor:pointer; }
                    .searchselect-option.selected { font-weight:bold; }
                    .searchselect-empty { padding:6px 8px; color:#999; }
                </style>
            </head>
            <body>
                <div id="app">%s</div>
            </body>
            </html>
            """.formatted(Entities.escape(title), widgets);
    }
}
