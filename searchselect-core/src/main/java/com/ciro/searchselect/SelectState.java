package com.ciro.searchselect;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Foto inmutable de un widget de selección con búsqueda.
 * <p>
 * Invariantes:
 * <ul>
 *   <li>{@code visibleItems} es siempre {@code items} filtrado por {@code searchValue},
 *       mismo orden relativo. Nunca se modifica por separado.</li>
 *   <li>{@code searchValue} vacío implica {@code visibleItems == items}.</li>
 *   <li>{@code value} no se valida contra {@code items}: un default que no está en el
 *       catálogo simplemente nunca aparece marcado como seleccionado (contrato del llamador).</li>
 * </ul>
 * Las transiciones viven en {@link SearchSelect#transition(Intent, SelectState)}.
 */
public final class SelectState<T> implements Serializable {

    private final List<Item<T>> items;
    private final List<Item<T>> visibleItems;
    private final Item<T> value;          // null = sin selección
    private final boolean open;
    private final String searchValue;
    private final boolean canClear;

    private SelectState(List<Item<T>> items,
                        List<Item<T>> visibleItems,
                        Item<T> value,
                        boolean open,
                        String searchValue,
                        boolean canClear) {
        this.items = List.copyOf(Objects.requireNonNull(items, "items"));
        this.visibleItems = List.copyOf(Objects.requireNonNull(visibleItems, "visibleItems"));
        this.value = value;
        this.open = open;
        this.searchValue = Objects.requireNonNull(searchValue, "searchValue");
        this.canClear = canClear;
    }

    /* ----------------- constructores públicos ----------------- */

    /** Catálogo explícito + selección opcional; el botón de limpiar está permitido. */
    public static <T> SelectState<T> init(List<Item<T>> items, Item<T> defaultValue) {
        List<Item<T>> copy = List.copyOf(items);
        return new SelectState<>(copy, copy, defaultValue, false, "", true);
    }

    /** Estado cero: sin catálogo, sin selección y sin botón de limpiar. */
    public static <T> SelectState<T> empty() {
        return new SelectState<>(List.of(), List.of(), null, false, "", false);
    }

    /* ----------------- lectura ----------------- */

    public List<Item<T>> items() {
        return items;
    }

    public List<Item<T>> visibleItems() {
        return visibleItems;
    }

    public Optional<Item<T>> value() {
        return Optional.ofNullable(value);
    }

    public boolean isOpen() {
        return open;
    }

    public String searchValue() {
        return searchValue;
    }

    public boolean canClear() {
        return canClear;
    }

    /* ----------------- derivados (solo para SearchSelect) ----------------- */

    SelectState<T> withOpen(boolean open) {
        return new SelectState<>(items, visibleItems, value, open, searchValue, canClear);
    }

    SelectState<T> withValue(Item<T> value) {
        return new SelectState<>(items, visibleItems, value, open, searchValue, canClear);
    }

    /** Reaplica el filtro: {@code visibleItems} se recalcula, nunca se recibe. */
    SelectState<T> withSearch(String text) {
        String q = (text == null) ? "" : text;
        return new SelectState<>(items, LabelMatcher.filter(items, q), value, open, q, canClear);
    }

    SelectState<T> withItems(List<Item<T>> newItems) {
        List<Item<T>> copy = List.copyOf(newItems);
        return new SelectState<>(copy, copy, value, open, searchValue, canClear)
                .withSearch(searchValue);
    }

    /** Cierra la lista y borra el filtro (común a Select y ConfirmSearch). */
    SelectState<T> collapsed() {
        return new SelectState<>(items, items, value, false, "", canClear);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectState<?> other)) return false;
        return open == other.open
                && canClear == other.canClear
                && items.equals(other.items)
                && visibleItems.equals(other.visibleItems)
                && Objects.equals(value, other.value)
                && searchValue.equals(other.searchValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items, visibleItems, value, open, searchValue, canClear);
    }

    @Override
    public String toString() {
        return "SelectState{items=" + items.size()
                + ", visible=" + visibleItems.size()
                + ", value=" + (value == null ? "-" : value.label())
                + ", open=" + open
                + ", search='" + searchValue + "'"
                + ", canClear=" + canClear + "}";
    }
}
