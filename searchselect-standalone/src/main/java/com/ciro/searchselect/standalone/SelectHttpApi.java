package com.ciro.searchselect.standalone;

import com.ciro.searchselect.Intent;
import com.ciro.searchselect.Item;
import com.ciro.searchselect.SearchSelectWidget;
import com.ciro.searchselect.SelectState;
import com.ciro.searchselect.view.SelectView;
import com.ciro.searchselect.view.ViewOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Núcleo del endpoint sin Undertow: resuelve el widget de la sesión,
 * decodifica la intención, la aplica y devuelve el HTML nuevo.
 */
public class SelectHttpApi {

    private static final Logger log = LoggerFactory.getLogger(SelectHttpApi.class);

    private final WidgetRegistry registry;
    private final WidgetStore store;
    private final IntentGuard guard;
    private final ObjectMapper mapper;

    public SelectHttpApi(WidgetRegistry registry, WidgetStore store, IntentGuard guard, ObjectMapper mapper) {
        this.registry = registry;
        this.store = store;
        this.guard = guard;
        this.mapper = mapper;
    }

    /** HTML actual de un widget para esta sesión (lo crea si hace falta). */
    public String render(String sessionId, String widgetId) {
        WidgetDefinition<?> def = registry.find(widgetId)
                .orElseThrow(() -> new IllegalArgumentException("Widget no registrado: " + widgetId));
        return renderWidget(store.getOrCreate(sessionId, def), def.viewOptions());
    }

    /** Aplica una intención y responde {ok, widget, html, value, open[, seq]} o un sobre de error. */
    public String dispatch(String sessionId, String widgetId, Map<String, Object> body) {

        Optional<WidgetDefinition<?>> def = registry.find(widgetId);
        if (def.isEmpty()) {
            return guard.errorJson("NOT_FOUND", "Widget no registrado: " + widgetId);
        }

        if (!guard.tryConsume(sessionId)) {
            log.warn("Rate limit alcanzado para la sesión {}", sessionId);
            return guard.errorJson("RATE_LIMIT", "Demasiadas intenciones, inténtalo en un instante");
        }

        IntentMessage msg;
        try {
            msg = mapper.convertValue(body, IntentMessage.class);
        } catch (IllegalArgumentException e) {
            log.warn("Intención mal formada en {}: {}", widgetId, e.getMessage());
            return guard.errorJson("BAD_REQUEST", "Cuerpo inválido");
        }

        SearchSelectWidget<?> widget = store.getOrCreate(sessionId, def.get());
        try {
            return apply(widget, msg, def.get().viewOptions());
        } catch (IntentDecodeException e) {
            log.warn("Intención rechazada en {}: {}", widgetId, e.getMessage());
            return guard.errorJson("BAD_REQUEST", e.getMessage());
        }
    }

    private <T> String apply(SearchSelectWidget<T> widget, IntentMessage msg, ViewOptions opts) throws IntentDecodeException {
        Optional<Intent<T>> intent = IntentDecoder.decode(msg, widget.state());
        SelectState<T> state = intent.map(widget::dispatch).orElseGet(widget::state);
        return okJson(widget.id(), state, opts, msg.seq());
    }

    private <T> String renderWidget(SearchSelectWidget<T> widget, ViewOptions opts) {
        return SelectView.renderHtml(widget.state(), opts);
    }

    private String okJson(String widgetId, SelectState<?> state, ViewOptions opts, Long seq) {
        Map<String, Object> env = new LinkedHashMap<>();
        env.put("ok", true);
        env.put("widget", widgetId);
        env.put("html", SelectView.renderHtml(state, opts));
        env.put("value", state.value().map(Item::label).orElse(null));
        env.put("open", state.isOpen());
        if (seq != null) env.put("seq", seq);
        try {
            return mapper.writeValueAsString(env);
        } catch (Exception e) {
            log.error("No se pudo serializar la respuesta de {}", widgetId, e);
            return guard.errorJson("INTERNAL", "Error serializando la respuesta");
        }
    }
}
