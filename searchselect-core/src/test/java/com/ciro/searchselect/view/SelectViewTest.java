package com.ciro.searchselect.view;

import com.ciro.searchselect.Intent;
import com.ciro.searchselect.Item;
import com.ciro.searchselect.SearchSelect;
import com.ciro.searchselect.SelectState;
import com.ciro.searchselect.dom.DomEvents;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectViewTest {

    private static final Item<Integer> APPLE   = Item.of("Apple", 1);
    private static final Item<Integer> BANANA  = Item.of("Banana", 2);
    private static final Item<Integer> AVOCADO = Item.of("Avocado", 3);
    private static final List<Item<Integer>> CATALOG = List.of(APPLE, BANANA, AVOCADO);

    private static SelectState<Integer> open(SelectState<Integer> s) {
        return SearchSelect.transition(Intent.toggle(), s);
    }

    @Test
    void closedWidgetShowsSelectionAndDownArrow() {
        ElementNode root = SelectView.render(SearchSelect.init(CATALOG, BANANA), ViewOptions.of("fruit"));

        assertTrue(root.hasClass(SelectView.CLOSED));
        assertEquals("fruit", root.attr(DomEvents.ATTR_WIDGET));
        assertEquals("Banana", root.byClass(SelectView.LABEL).orElseThrow().text());
        assertEquals(SelectView.ARROW_DOWN, root.byClass(SelectView.ARROW).orElseThrow().attr("data-arrow"));
        assertTrue(root.byClass(SelectView.DROPDOWN).isPresent());
        assertTrue(root.byClass(SelectView.EMPTY).isEmpty());
    }

    @Test
    void openWidgetListsVisibleItemsWithUpArrow() {
        ElementNode root = SelectView.render(open(SearchSelect.init(CATALOG, null)), ViewOptions.of("fruit"));

        assertTrue(root.hasClass(SelectView.OPEN));
        assertEquals(SelectView.ARROW_UP, root.byClass(SelectView.ARROW).orElseThrow().attr("data-arrow"));

        List<ElementNode> rows = root.findAll(n -> n.hasClass(SelectView.OPTION));
        assertEquals(3, rows.size());
        assertEquals("Avocado", rows.get(2).text());
        assertEquals("2", rows.get(2).attr(DomEvents.ATTR_INDEX));
        assertEquals(DomEvents.SELECT, rows.get(0).attr(DomEvents.ATTR_INTENT));
    }

    @Test
    void searchInputMirrorsSearchValue() {
        SelectState<Integer> s = SearchSelect.transition(Intent.search("av"), open(SearchSelect.init(CATALOG, null)));
        ElementNode input = SelectView.render(s).byClass(SelectView.SEARCH).orElseThrow();

        assertEquals("av", input.attr("value"));
        assertEquals(DomEvents.SEARCH, input.attr(DomEvents.ATTR_INTENT));
    }

    @Test
    void selectedRowIsMatchedByLabelOnly() {
        Item<Integer> otherBanana = Item.of("Banana", 200);
        SelectState<Integer> s = open(SearchSelect.init(List.of(APPLE, otherBanana), BANANA));

        List<ElementNode> selected = SelectView.render(s).findAll(n -> n.hasClass(SelectView.SELECTED));

        assertEquals(1, selected.size());
        assertEquals("Banana", selected.get(0).text());
    }

    @Test
    void defaultOutsideCatalogIsNeverHighlighted() {
        SelectState<Integer> s = open(SearchSelect.init(CATALOG, Item.of("Kiwi", 9)));

        assertTrue(SelectView.render(s).findAll(n -> n.hasClass(SelectView.SELECTED)).isEmpty());
        assertEquals("Kiwi", SelectView.selectedText(s));
    }

    @Test
    void clearButtonNeedsPermissionAndASelection() {
        assertTrue(SelectView.isClearVisible(SearchSelect.init(CATALOG, APPLE)));
        assertFalse(SelectView.isClearVisible(SearchSelect.init(CATALOG, null)));
        assertFalse(SelectView.isClearVisible(SearchSelect.init(CATALOG, Item.of("", 0))));

        ElementNode root = SelectView.render(SearchSelect.init(CATALOG, APPLE));
        ElementNode clear = root.byClass(SelectView.CLEAR).orElseThrow();
        assertEquals(DomEvents.CLEAR, clear.attr(DomEvents.ATTR_INTENT));
        assertEquals("true", clear.attr(DomEvents.ATTR_PREVENT));
    }

    @Test
    void stateBuiltFromEmptyNeverShowsClear() {
        SelectState<Integer> s = SearchSelect.empty();
        s = SearchSelect.transition(Intent.replaceItems(CATALOG, null), s);
        s = SearchSelect.transition(Intent.toggle(), s);
        s = SearchSelect.transition(Intent.select(APPLE), s);

        assertEquals("Apple", SelectView.selectedText(s));
        assertFalse(SelectView.isClearVisible(s));
        assertTrue(SelectView.render(s).byClass(SelectView.CLEAR).isEmpty());
    }

    @Test
    void noMatchMessageOnlyWhenSearchingWithoutResults() {
        SelectState<Integer> searching = SearchSelect.transition(Intent.search("zzz"), open(SearchSelect.init(CATALOG, null)));
        ElementNode empty = SelectView.render(searching).byClass(SelectView.EMPTY).orElseThrow();
        assertEquals(ViewOptions.DEFAULT_EMPTY_MESSAGE, empty.text());

        // catálogo vacío sin búsqueda: no es "sin coincidencias"
        SelectState<Integer> noCatalog = open(SearchSelect.<Integer>empty());
        assertFalse(SelectView.isNoMatch(noCatalog));
        assertTrue(SelectView.render(noCatalog).byClass(SelectView.EMPTY).isEmpty());
    }

    @Test
    void noMatchMessageSurvivesCollapseWithPendingSearch() {
        SelectState<Integer> searching = SearchSelect.transition(Intent.search("zzz"), open(SearchSelect.init(CATALOG, null)));
        SelectState<Integer> closed = SearchSelect.transition(Intent.toggle(), searching);

        ElementNode root = SelectView.render(closed);

        assertTrue(root.hasClass(SelectView.CLOSED));
        assertTrue(SelectView.isNoMatch(closed));
        assertEquals(ViewOptions.DEFAULT_EMPTY_MESSAGE, root.byClass(SelectView.EMPTY).orElseThrow().text());
    }

    @Test
    void placeholderIsShownWithoutSelection() {
        ElementNode root = SelectView.render(SearchSelect.init(CATALOG, null),
                ViewOptions.of("fruit").withPlaceholder("Pick a fruit"));

        ElementNode label = root.byClass(SelectView.LABEL).orElseThrow();
        assertTrue(label.hasClass(SelectView.PLACEHOLDER));
        assertEquals("Pick a fruit", label.text());
    }

    @Test
    void toggleHeaderSuppressesDefaultNavigation() {
        ElementNode header = SelectView.render(SearchSelect.init(CATALOG, null)).byClass(SelectView.VALUE).orElseThrow();

        assertEquals(DomEvents.TOGGLE, header.attr(DomEvents.ATTR_INTENT));
        assertEquals("true", header.attr(DomEvents.ATTR_PREVENT));
    }
}
