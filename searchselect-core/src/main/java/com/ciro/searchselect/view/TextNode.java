package com.ciro.searchselect.view;

import org.jsoup.nodes.Element;

public class TextNode implements ViewNode {
    public final String text;

    public TextNode(String text) {
        this.text = (text == null) ? "" : text;
    }

    @Override
    public void appendTo(Element parent) {
        parent.appendText(text);
    }

    @Override
    public String text() {
        return text;
    }
}
