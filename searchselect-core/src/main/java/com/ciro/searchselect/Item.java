package com.ciro.searchselect;

import java.io.Serializable;
import java.util.Objects;

/**
 * Una entrada del catálogo: etiqueta visible + payload del llamador.
 * <p>
 * El core nunca inspecciona {@code payload}; la etiqueta es la única clave
 * de búsqueda y de "está seleccionado".
 */
public record Item<T>(String label, T payload) implements Serializable {

    public Item {
        Objects.requireNonNull(label, "label");
    }

    public static <T> Item<T> of(String label, T payload) {
        return new Item<>(label, payload);
    }

    /** Mismo criterio que el resaltado de la vista: solo compara etiquetas. */
    public boolean sameLabel(Item<?> other) {
        return other != null && label.equals(other.label);
    }
}
