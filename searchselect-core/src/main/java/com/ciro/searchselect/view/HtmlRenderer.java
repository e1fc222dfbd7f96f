package com.ciro.searchselect.view;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Árbol de vista → HTML compacto. El escapado lo hace jsoup.
 */
public final class HtmlRenderer {

    private HtmlRenderer() {}

    public static String toHtml(ViewNode root) {
        Document doc = Document.createShell("");
        doc.outputSettings()
           .prettyPrint(false)
           .syntax(Document.OutputSettings.Syntax.html);

        Element body = doc.body();
        root.appendTo(body);
        return body.html();
    }
}
