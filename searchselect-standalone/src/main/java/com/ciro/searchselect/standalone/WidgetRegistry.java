package com.ciro.searchselect.standalone;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registro manual de los widgets que pinta la página, en orden de alta.
 */
public class WidgetRegistry {

    private final Map<String, WidgetDefinition<?>> defs = new LinkedHashMap<>();

    /**
     * Registra un widget nuevo.
     * Ejemplo: registry.add(WidgetDefinition.clearable("country", "País", Countries::all, null));
     */
    public void add(WidgetDefinition<?> def) {
        if (defs.putIfAbsent(def.id(), def) != null) {
            throw new IllegalStateException("Widget duplicado: " + def.id());
        }
    }

    public Optional<WidgetDefinition<?>> find(String id) {
        return Optional.ofNullable(defs.get(id));
    }

    public Collection<WidgetDefinition<?>> all() {
        return List.copyOf(new ArrayList<>(defs.values()));
    }
}
