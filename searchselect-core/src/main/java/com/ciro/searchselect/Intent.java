package com.ciro.searchselect;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Intenciones que la capa de presentación levanta hacia el widget.
 * Conjunto cerrado: toda intención es válida en todo estado.
 */
public sealed interface Intent<T>
        permits Intent.ToggleOpen, Intent.Select, Intent.Clear,
                Intent.Search, Intent.ConfirmSearch, Intent.ReplaceItems {

    record ToggleOpen<T>() implements Intent<T> {}

    record Select<T>(Item<T> item) implements Intent<T> {
        public Select {
            Objects.requireNonNull(item, "item");
        }
    }

    record Clear<T>() implements Intent<T> {}

    record Search<T>(String text) implements Intent<T> {
        public Search {
            text = (text == null) ? "" : text;
        }
    }

    /** Enter en el input: acepta la primera coincidencia visible. */
    record ConfirmSearch<T>() implements Intent<T> {}

    record ReplaceItems<T>(List<Item<T>> items, Item<T> selection) implements Intent<T> {
        public ReplaceItems {
            items = List.copyOf(items);
        }
    }

    /* ----------------- atajos ----------------- */

    static <T> Intent<T> toggle() { return new ToggleOpen<>(); }

    static <T> Intent<T> select(Item<T> item) { return new Select<>(item); }

    static <T> Intent<T> clear() { return new Clear<>(); }

    static <T> Intent<T> search(String text) { return new Search<>(text); }

    static <T> Intent<T> confirm() { return new ConfirmSearch<>(); }

    static <T> Intent<T> replaceItems(List<Item<T>> items, Item<T> selection) {
        return new ReplaceItems<>(items, selection);
    }

    /**
     * Resuelve un índice de {@code visibleItems} (lo único que un shell remoto conoce)
     * a un {@code Select}. Índice fuera de rango: vacío, no es un error.
     */
    static <T> Optional<Intent<T>> selectVisible(SelectState<T> state, int index) {
        List<Item<T>> visible = state.visibleItems();
        if (index < 0 || index >= visible.size()) return Optional.empty();
        return Optional.of(new Select<>(visible.get(index)));
    }
}
