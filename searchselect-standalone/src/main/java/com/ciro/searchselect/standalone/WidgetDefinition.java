package com.ciro.searchselect.standalone;

import com.ciro.searchselect.Item;
import com.ciro.searchselect.SearchSelect;
import com.ciro.searchselect.SearchSelectWidget;
import com.ciro.searchselect.SelectState;
import com.ciro.searchselect.view.ViewOptions;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Receta de un widget de la página: de aquí sale una instancia nueva por sesión.
 *
 * @param clearable {@code false} arranca desde {@code empty()} y carga el catálogo
 *                  con replaceItems, así que nunca muestra el botón de limpiar
 */
public record WidgetDefinition<T>(String id,
                                  String placeholder,
                                  Supplier<List<Item<T>>> catalog,
                                  Item<T> defaultValue,
                                  boolean clearable) {

    public WidgetDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(catalog, "catalog");
        placeholder = (placeholder == null) ? "" : placeholder;
    }

    public static <T> WidgetDefinition<T> clearable(String id, String placeholder,
                                                    Supplier<List<Item<T>>> catalog, Item<T> defaultValue) {
        return new WidgetDefinition<>(id, placeholder, catalog, defaultValue, true);
    }

    public static <T> WidgetDefinition<T> fixed(String id, String placeholder,
                                                Supplier<List<Item<T>>> catalog, Item<T> defaultValue) {
        return new WidgetDefinition<>(id, placeholder, catalog, defaultValue, false);
    }

    public SearchSelectWidget<T> newWidget() {
        SelectState<T> initial = clearable
                ? SearchSelect.init(catalog.get(), defaultValue)
                : SearchSelect.replaceItems(SearchSelect.<T>empty(), catalog.get(), defaultValue);
        return new SearchSelectWidget<>(id, initial);
    }

    public ViewOptions viewOptions() {
        return ViewOptions.of(id).withPlaceholder(placeholder);
    }
}
