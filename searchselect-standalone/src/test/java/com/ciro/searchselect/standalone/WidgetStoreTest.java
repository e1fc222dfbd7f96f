package com.ciro.searchselect.standalone;

import com.ciro.searchselect.Intent;
import com.ciro.searchselect.SearchSelectWidget;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WidgetStoreTest {

    private final WidgetDefinition<Integer> fruit =
            WidgetDefinition.clearable("fruit", "", Main::fruits, null);

    @Test
    void sameSessionGetsTheSameInstance() {
        WidgetStore store = new WidgetStore(30, 100);

        SearchSelectWidget<?> a = store.getOrCreate("s1", fruit);
        SearchSelectWidget<?> b = store.getOrCreate("s1", fruit);

        assertSame(a, b);
        assertNotSame(a, store.getOrCreate("s2", fruit));
    }

    @Test
    void removeSessionDropsOnlyThatSession() {
        WidgetStore store = new WidgetStore(30, 100);
        SearchSelectWidget<?> s1 = store.getOrCreate("s1", fruit);
        SearchSelectWidget<?> s2 = store.getOrCreate("s2", fruit);

        store.removeSession("s1");

        assertEquals(1, store.size());
        assertSame(s2, store.getOrCreate("s2", fruit));
        assertNotSame(s1, store.getOrCreate("s1", fruit));
    }

    @Test
    void widgetsOfAnEndedSessionStartFresh() {
        WidgetStore store = new WidgetStore(30, 100);
        @SuppressWarnings("unchecked")
        SearchSelectWidget<Integer> w = (SearchSelectWidget<Integer>) store.getOrCreate("s1", fruit);
        w.dispatch(Intent.toggle());

        store.removeSession("s1");

        assertFalse(store.getOrCreate("s1", fruit).state().isOpen());
    }
}
