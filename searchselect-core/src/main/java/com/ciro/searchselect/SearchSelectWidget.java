package com.ciro.searchselect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Dueño de un {@link SelectState}: guarda el estado actual, aplica intenciones
 * de una en una y publica el resultado a los listeners (re-render).
 * <p>
 * Cada instancia es independiente; no hay estado global entre widgets.
 */
public final class SearchSelectWidget<T> {

    private static final Logger log = LoggerFactory.getLogger(SearchSelectWidget.class);

    private final String id;
    private SelectState<T> state;
    private final List<Consumer<SelectState<T>>> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    public SearchSelectWidget(String id, SelectState<T> initial) {
        this.id = Objects.requireNonNull(id, "id");
        this.state = Objects.requireNonNull(initial, "initial");
    }

    public static <T> SearchSelectWidget<T> of(String id, List<Item<T>> items, Item<T> defaultValue) {
        return new SearchSelectWidget<>(id, SelectState.init(items, defaultValue));
    }

    public String id() {
        return id;
    }

    public SelectState<T> state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public Optional<T> value() {
        return SearchSelect.getValue(state());
    }

    /**
     * Aplica la intención y devuelve el nuevo estado. Los listeners ven
     * únicamente estados completos.
     */
    public SelectState<T> dispatch(Intent<T> intent) {
        Objects.requireNonNull(intent, "intent");
        SelectState<T> next;
        List<Consumer<SelectState<T>>> snapshot;

        lock.lock();
        try {
            SelectState<T> prev = state;
            next = SearchSelect.transition(intent, prev);
            state = next;
            snapshot = new ArrayList<>(listeners);
            if (log.isDebugEnabled()) {
                log.debug("[{}] {} : {} -> {}", id, intent.getClass().getSimpleName(), prev, next);
            }
        } finally {
            lock.unlock();
        }

        // fuera del lock: un listener puede volver a llamar a dispatch
        snapshot.forEach(l -> l.accept(next));
        return next;
    }

    public SelectState<T> replaceItems(List<Item<T>> items, Item<T> selection) {
        return dispatch(Intent.replaceItems(items, selection));
    }

    /** Devuelve el "unsubscribe". */
    public Runnable onChange(Consumer<SelectState<T>> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void clearListeners() {
        listeners.clear();
    }
}
