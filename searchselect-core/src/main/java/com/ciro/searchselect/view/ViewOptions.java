package com.ciro.searchselect.view;

import java.util.Objects;

/**
 * Textos y el id con el que se pinta un widget.
 */
public record ViewOptions(String widgetId, String placeholder, String emptyMessage) {

    public static final String DEFAULT_EMPTY_MESSAGE = "No match found";

    public ViewOptions {
        Objects.requireNonNull(widgetId, "widgetId");
        placeholder = (placeholder == null) ? "" : placeholder;
        emptyMessage = (emptyMessage == null || emptyMessage.isBlank()) ? DEFAULT_EMPTY_MESSAGE : emptyMessage;
    }

    public static ViewOptions of(String widgetId) {
        return new ViewOptions(widgetId, "", DEFAULT_EMPTY_MESSAGE);
    }

    public ViewOptions withPlaceholder(String placeholder) {
        return new ViewOptions(widgetId, placeholder, emptyMessage);
    }
}
