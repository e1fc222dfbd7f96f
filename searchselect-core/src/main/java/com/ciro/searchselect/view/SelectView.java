package com.ciro.searchselect.view;

import static com.ciro.searchselect.view.ElementNode.el;

import com.ciro.searchselect.Item;
import com.ciro.searchselect.SelectState;
import com.ciro.searchselect.dom.DomEvents;

import java.util.List;

/**
 * {@code render(state)}: qué se muestra, no cómo se dibuja.
 * Función pura, se invoca en cada cambio de estado.
 */
public final class SelectView {

    public static final String ROOT      = "searchselect";
    public static final String VALUE     = "searchselect-value";
    public static final String LABEL     = "searchselect-label";
    public static final String CLEAR     = "searchselect-clear";
    public static final String ARROW     = "searchselect-arrow";
    public static final String DROPDOWN  = "searchselect-dropdown";
    public static final String SEARCH    = "searchselect-search";
    public static final String OPTIONS   = "searchselect-options";
    public static final String OPTION    = "searchselect-option";
    public static final String EMPTY     = "searchselect-empty";

    public static final String OPEN      = "open";
    public static final String CLOSED    = "closed";
    public static final String SELECTED  = "selected";
    public static final String PLACEHOLDER = "placeholder";

    public static final String ARROW_UP   = "up";
    public static final String ARROW_DOWN = "down";

    private static final String GLYPH_UP    = "▲";
    private static final String GLYPH_DOWN  = "▼";
    private static final String GLYPH_CLEAR = "×";

    private SelectView() {}

    /* ----------------- reglas de visibilidad ----------------- */

    /**
     * El botón de limpiar solo aparece si está permitido Y hay una etiqueta
     * seleccionada no vacía.
     */
    public static boolean isClearVisible(SelectState<?> state) {
        return state.canClear()
                && state.value().map(v -> !v.label().isEmpty()).orElse(false);
    }

    /** "Sin coincidencias" (no confundir con "catálogo vacío"). */
    public static boolean isNoMatch(SelectState<?> state) {
        return state.visibleItems().isEmpty() && !state.searchValue().isEmpty();
    }

    /** Compara por etiqueta: dos items con igual label y distinto payload se marcan igual. */
    public static boolean isSelected(SelectState<?> state, Item<?> item) {
        return state.value().map(item::sameLabel).orElse(false);
    }

    public static String arrow(SelectState<?> state) {
        return state.isOpen() ? ARROW_UP : ARROW_DOWN;
    }

    public static String selectedText(SelectState<?> state) {
        return state.value().map(Item::label).orElse("");
    }

    /* ----------------- render ----------------- */

    public static <T> ElementNode render(SelectState<T> state) {
        return render(state, ViewOptions.of(ROOT));
    }

    public static <T> ElementNode render(SelectState<T> state, ViewOptions opts) {
        ElementNode root = el("div", ROOT, state.isOpen() ? OPEN : CLOSED)
                .attr(DomEvents.ATTR_WIDGET, opts.widgetId());

        // el desplegable siempre va en el árbol; la clase closed lo oculta
        root.child(header(state, opts));
        root.child(dropdown(state, opts));
        return root;
    }

    public static <T> String renderHtml(SelectState<T> state, ViewOptions opts) {
        return HtmlRenderer.toHtml(render(state, opts));
    }

    private static ElementNode header(SelectState<?> state, ViewOptions opts) {
        ElementNode header = el("div", VALUE)
                .attr(DomEvents.ATTR_INTENT, DomEvents.TOGGLE)
                .attr(DomEvents.ATTR_PREVENT, "true");

        String text = selectedText(state);
        ElementNode label = el("span", LABEL);
        if (text.isEmpty()) {
            label.cls(PLACEHOLDER).text(opts.placeholder());
        } else {
            label.text(text);
        }
        header.child(label);

        if (isClearVisible(state)) {
            header.child(el("a", CLEAR)
                    .attr("href", "#")
                    .attr(DomEvents.ATTR_INTENT, DomEvents.CLEAR)
                    .attr(DomEvents.ATTR_PREVENT, "true")
                    .text(GLYPH_CLEAR));
        }

        String dir = arrow(state);
        header.child(el("span", ARROW, "arrow-" + dir)
                .attr("data-arrow", dir)
                .text(ARROW_UP.equals(dir) ? GLYPH_UP : GLYPH_DOWN));
        return header;
    }

    private static ElementNode dropdown(SelectState<?> state, ViewOptions opts) {
        ElementNode box = el("div", DROPDOWN);

        box.child(el("input", SEARCH)
                .attr("type", "text")
                .attr("autocomplete", "off")
                .attr("value", state.searchValue())
                .attr(DomEvents.ATTR_INTENT, DomEvents.SEARCH));

        ElementNode list = el("ul", OPTIONS);
        List<? extends Item<?>> visible = state.visibleItems();
        for (int i = 0; i < visible.size(); i++) {
            Item<?> it = visible.get(i);
            ElementNode row = el("li", OPTION)
                    .attr(DomEvents.ATTR_INTENT, DomEvents.SELECT)
                    .attr(DomEvents.ATTR_INDEX, Integer.toString(i))
                    .text(it.label());
            if (isSelected(state, it)) row.cls(SELECTED);
            list.child(row);
        }
        box.child(list);

        if (isNoMatch(state)) {
            box.child(el("div", EMPTY).text(opts.emptyMessage()));
        }
        return box;
    }
}
