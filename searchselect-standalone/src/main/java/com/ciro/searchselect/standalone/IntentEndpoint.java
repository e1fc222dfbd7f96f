package com.ciro.searchselect.standalone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Adapter Undertow: POST /intent/{widgetId}
 * <p>
 * El body se lee con receiveFullBytes(); la lógica real está en {@link SelectHttpApi}.
 */
public final class IntentEndpoint implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(IntentEndpoint.class);
    private static final String JSON = "application/json; charset=utf-8";

    private final ObjectMapper objectMapper;
    private final StandaloneSessionManager sessions;
    private final SelectHttpApi api;
    private final IntentGuard guard;

    public IntentEndpoint(SelectHttpApi api,
                          IntentGuard guard,
                          ObjectMapper objectMapper,
                          StandaloneSessionManager sessions) {
        this.api = api;
        this.guard = guard;
        this.objectMapper = objectMapper;
        this.sessions = sessions;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {

        if (!exchange.getRequestMethod().equalToString("POST")) {
            send(exchange, 405, guard.errorJson("METHOD_NOT_ALLOWED", "Only POST is allowed"));
            return;
        }

        final String widgetId = extractWidgetId(exchange.getRequestPath());
        if (widgetId == null || widgetId.isBlank()) {
            send(exchange, 404, guard.errorJson("NOT_FOUND", "Widget not found"));
            return;
        }

        exchange.getRequestReceiver().receiveFullBytes((ex, bytes) -> {
            try {
                String sid = sessions.ensureSession(ex);
                sessions.touchNoCache(ex);

                Map<String, Object> body = parseBody(bytes);
                send(ex, 200, api.dispatch(sid, widgetId, body));

            } catch (JsonProcessingException e) {
                send(ex, 400, guard.errorJson("BAD_REQUEST", "JSON inválido"));
            } catch (Exception e) {
                log.error("Error procesando intención para {}", widgetId, e);
                send(ex, 500, guard.errorJson("INTERNAL", "Error interno"));
            }
        }, (ex, err) -> {
            log.warn("No se pudo leer el body de /intent/{}: {}", widgetId, err.getMessage());
            send(ex, 400, guard.errorJson("BAD_REQUEST", "No se pudo leer el body"));
        });
    }

    private Map<String, Object> parseBody(byte[] bytes) throws JsonProcessingException {
        if (bytes == null || bytes.length == 0) return Map.of();
        String raw = new String(bytes, StandardCharsets.UTF_8).trim();
        if (raw.isEmpty()) return Map.of();
        @SuppressWarnings("unchecked")
        Map<String, Object> map = objectMapper.readValue(raw, Map.class);
        return (map == null) ? Map.of() : map;
    }

    static String extractWidgetId(String requestPath) {
        // ej: "/intent/country" -> "country"
        if (requestPath == null) return null;
        int idx = requestPath.lastIndexOf('/');
        if (idx < 0 || idx == requestPath.length() - 1) return null;
        return requestPath.substring(idx + 1);
    }

    private static void send(HttpServerExchange ex, int status, String json) {
        ex.setStatusCode(status);
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, JSON);
        ex.getResponseSender().send(json);
    }
}
