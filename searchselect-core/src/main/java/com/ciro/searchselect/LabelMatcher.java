package com.ciro.searchselect;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Predicado de búsqueda: subcadena sin distinguir mayúsculas.
 * Sin ranking ni fuzzy, el orden del resultado es siempre el del catálogo.
 */
public final class LabelMatcher {

    private LabelMatcher() {}

    public static boolean matches(String label, String query) {
        if (query == null || query.isEmpty()) return true;
        // ROOT: plegado simple, no colación dependiente del locale
        return label.toLowerCase(Locale.ROOT).contains(query.toLowerCase(Locale.ROOT));
    }

    public static <T> List<Item<T>> filter(List<Item<T>> items, String query) {
        if (query == null || query.isEmpty()) return items;

        List<Item<T>> out = new ArrayList<>();
        for (Item<T> it : items) {
            if (matches(it.label(), query)) out.add(it);
        }
        return List.copyOf(out);
    }
}
