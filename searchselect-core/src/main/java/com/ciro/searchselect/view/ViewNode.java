package com.ciro.searchselect.view;

import org.jsoup.nodes.Element;

public interface ViewNode {
    /** Vuelca el nodo como hijo de {@code parent} (jsoup escapa el contenido). */
    void appendTo(Element parent);

    /** Texto plano concatenado del subárbol. */
    String text();
}
