package com.ciro.searchselect.view;

import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

public class ElementNode implements ViewNode {
    public final String tagName;
    public final Map<String, String> attributes = new LinkedHashMap<>();
    public final Set<String> classes = new LinkedHashSet<>();
    public final List<ViewNode> children = new ArrayList<>();

    public ElementNode(String tagName) {
        this.tagName = tagName;
    }

    public static ElementNode el(String tagName, String... classNames) {
        ElementNode n = new ElementNode(tagName);
        for (String c : classNames) n.cls(c);
        return n;
    }

    /* ----------------- builder ----------------- */

    public ElementNode attr(String key, String value) {
        attributes.put(key, value);
        return this;
    }

    public ElementNode cls(String className) {
        if (className != null && !className.isBlank()) classes.add(className);
        return this;
    }

    public ElementNode child(ViewNode node) {
        children.add(node);
        return this;
    }

    public ElementNode text(String text) {
        children.add(new TextNode(text));
        return this;
    }

    /* ----------------- lectura ----------------- */

    public boolean hasClass(String className) {
        return classes.contains(className);
    }

    public String attr(String key) {
        return attributes.get(key);
    }

    @Override
    public String text() {
        StringBuilder sb = new StringBuilder();
        for (ViewNode c : children) sb.append(c.text());
        return sb.toString();
    }

    /** Búsqueda en profundidad, incluido este nodo. */
    public Optional<ElementNode> find(Predicate<ElementNode> p) {
        if (p.test(this)) return Optional.of(this);
        for (ViewNode c : children) {
            if (c instanceof ElementNode el) {
                Optional<ElementNode> hit = el.find(p);
                if (hit.isPresent()) return hit;
            }
        }
        return Optional.empty();
    }

    public List<ElementNode> findAll(Predicate<ElementNode> p) {
        List<ElementNode> out = new ArrayList<>();
        collect(p, out);
        return out;
    }

    public Optional<ElementNode> byClass(String className) {
        return find(n -> n.hasClass(className));
    }

    private void collect(Predicate<ElementNode> p, List<ElementNode> out) {
        if (p.test(this)) out.add(this);
        for (ViewNode c : children) {
            if (c instanceof ElementNode el) el.collect(p, out);
        }
    }

    @Override
    public void appendTo(Element parent) {
        Element el = parent.appendElement(tagName);
        for (Map.Entry<String, String> a : attributes.entrySet()) {
            el.attr(a.getKey(), a.getValue() == null ? "" : a.getValue());
        }
        if (!classes.isEmpty()) {
            el.attr("class", String.join(" ", classes));
        }
        for (ViewNode c : children) c.appendTo(el);
    }
}
