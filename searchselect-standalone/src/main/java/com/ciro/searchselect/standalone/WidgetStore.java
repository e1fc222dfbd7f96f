package com.ciro.searchselect.standalone;

import com.ciro.searchselect.SearchSelectWidget;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Un {@link SearchSelectWidget} por (sesión, widget), en memoria.
 * Se crea bajo demanda a partir de su {@link WidgetDefinition}.
 */
public class WidgetStore {

    private static final Logger log = LoggerFactory.getLogger(WidgetStore.class);

    private final Cache<String, SearchSelectWidget<?>> cache;

    public WidgetStore(StandaloneConfig cfg) {
        this(cfg.getSessionTtlMinutes(), cfg.getMaxWidgets());
    }

    public WidgetStore(long ttlMinutes, long maxSize) {
        this.cache = Caffeine.newBuilder()
                .expireAfterAccess(ttlMinutes, TimeUnit.MINUTES)
                .maximumSize(maxSize)
                .removalListener((String key, SearchSelectWidget<?> val, RemovalCause cause) -> {
                    // sin listeners colgando de un widget que ya nadie ve
                    if (val != null) val.clearListeners();
                    if (cause.wasEvicted()) log.debug("Widget {} descartado ({})", key, cause);
                })
                .build();
    }

    // Clave compuesta para evitar colisiones entre sesiones
    private static String k(String sid, String widgetId) {
        return sid + "::" + widgetId;
    }

    public SearchSelectWidget<?> getOrCreate(String sid, WidgetDefinition<?> def) {
        return cache.get(k(sid, def.id()), key -> def.newWidget());
    }

    public void removeSession(String sid) {
        // O(n) sobre las claves presentes
        cache.asMap().keySet().removeIf(key -> key.startsWith(sid + "::"));
    }

    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
