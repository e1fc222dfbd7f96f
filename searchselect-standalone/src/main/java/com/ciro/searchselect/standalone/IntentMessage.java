package com.ciro.searchselect.standalone;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Lo que manda el runtime JS: {@code {"type":"search","text":"av"}},
 * {@code {"type":"select","index":2}}, {@code {"type":"keydown","keyCode":13}}...
 * <p>
 * {@code seq} es el contador del cliente; vuelve tal cual en la respuesta para
 * que el runtime descarte renders más viejos que su última búsqueda.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntentMessage(String type, String text, Integer index, Integer keyCode, Long seq) {

    @JsonCreator
    public IntentMessage {
    }

    public static IntentMessage of(String type) {
        return new IntentMessage(type, null, null, null, null);
    }
}
