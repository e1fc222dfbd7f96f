package com.ciro.searchselect;

import java.util.List;
import java.util.Optional;

/**
 * API pública del widget: constructores, consulta y la función de transición.
 * <p>
 * {@code transition} es pura y total: no hay estados ilegales ni excepciones
 * para intenciones no nulas.
 */
public final class SearchSelect {

    private SearchSelect() {}

    public static <T> SelectState<T> init(List<Item<T>> items, Item<T> defaultValue) {
        return SelectState.init(items, defaultValue);
    }

    public static <T> SelectState<T> empty() {
        return SelectState.empty();
    }

    /** Solo el payload de la selección actual, sin etiqueta. */
    public static <T> Optional<T> getValue(SelectState<T> state) {
        return state.value().map(Item::payload);
    }

    /** Única forma sancionada de cambiar el catálogo en mitad de la sesión. */
    public static <T> SelectState<T> replaceItems(SelectState<T> state, List<Item<T>> items, Item<T> selection) {
        return transition(Intent.replaceItems(items, selection), state);
    }

    public static <T> SelectState<T> transition(Intent<T> intent, SelectState<T> state) {
        if (intent instanceof Intent.ToggleOpen<T>) {
            return state.withOpen(!state.isOpen());
        }
        if (intent instanceof Intent.Select<T> select) {
            return state.withValue(select.item()).collapsed();
        }
        if (intent instanceof Intent.Clear<T>) {
            return state.withValue(null);
        }
        if (intent instanceof Intent.Search<T> search) {
            return state.withSearch(search.text());
        }
        if (intent instanceof Intent.ConfirmSearch<T>) {
            List<Item<T>> visible = state.visibleItems();
            // primera coincidencia del filtro, no del catálogo completo
            SelectState<T> next = visible.isEmpty() ? state : state.withValue(visible.get(0));
            return next.collapsed();
        }
        if (intent instanceof Intent.ReplaceItems<T> replace) {
            return state.withValue(replace.selection()).withItems(replace.items());
        }
        throw new IllegalArgumentException("Intent desconocido: " + intent);
    }
}
