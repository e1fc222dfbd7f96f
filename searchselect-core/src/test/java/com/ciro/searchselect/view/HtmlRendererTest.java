package com.ciro.searchselect.view;

import com.ciro.searchselect.Intent;
import com.ciro.searchselect.Item;
import com.ciro.searchselect.SearchSelect;
import com.ciro.searchselect.SelectState;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HtmlRendererTest {

    @Test
    void labelsAreEscaped() {
        SelectState<String> s = SearchSelect.init(List.of(Item.of("<b>Tom & Jerry</b>", "x")), null);
        s = SearchSelect.transition(Intent.toggle(), s);

        String html = SelectView.renderHtml(s, ViewOptions.of("w1"));

        assertFalse(html.contains("<b>"));
        assertTrue(html.contains("&lt;b&gt;Tom &amp; Jerry&lt;/b&gt;"));
    }

    @Test
    void producesParseableMarkupWithIntents() {
        SelectState<String> s = SearchSelect.init(List.of(Item.of("One", "1"), Item.of("Two", "2")), Item.of("Two", "2"));
        s = SearchSelect.transition(Intent.toggle(), s);

        Document doc = Jsoup.parseBodyFragment(SelectView.renderHtml(s, ViewOptions.of("nums")));

        Element root = doc.selectFirst("div.searchselect");
        assertNotNull(root);
        assertTrue(root.hasClass("open"));
        assertEquals("nums", root.attr("data-widget"));

        Elements rows = doc.select("li[data-intent=select]");
        assertEquals(2, rows.size());
        assertTrue(rows.get(1).hasClass("selected"));
        assertNotNull(doc.selectFirst("input[data-intent=search]"));
        assertNotNull(doc.selectFirst("a.searchselect-clear[data-prevent=true]"));
    }

    @Test
    void outputIsCompact() {
        String html = HtmlRenderer.toHtml(ElementNode.el("div", "a").child(ElementNode.el("span").text("x")));

        assertEquals("<div class=\"a\"><span>x</span></div>", html);
    }
}
