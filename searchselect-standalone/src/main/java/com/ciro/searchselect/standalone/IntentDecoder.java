package com.ciro.searchselect.standalone;

import com.ciro.searchselect.Intent;
import com.ciro.searchselect.SelectState;
import com.ciro.searchselect.dom.DomEvents;

import java.util.Optional;

/**
 * {@link IntentMessage} → {@link Intent}.
 * <p>
 * Vacío significa "no hay nada que hacer" (índice fuera de rango, tecla que no es Enter);
 * el estado queda igual y la respuesta sigue siendo ok.
 */
public final class IntentDecoder {

    public static final String KEYDOWN = "keydown";

    private IntentDecoder() {}

    public static <T> Optional<Intent<T>> decode(IntentMessage msg, SelectState<T> state) throws IntentDecodeException {
        if (msg == null || msg.type() == null || msg.type().isBlank()) {
            throw new IntentDecodeException("Falta 'type'");
        }

        return switch (msg.type()) {
            case DomEvents.TOGGLE  -> Optional.of(Intent.toggle());
            case DomEvents.CLEAR   -> Optional.of(Intent.clear());
            case DomEvents.CONFIRM -> Optional.of(Intent.confirm());
            case DomEvents.SEARCH  -> Optional.of(Intent.search(msg.text()));
            case DomEvents.SELECT  -> {
                if (msg.index() == null) throw new IntentDecodeException("'select' requiere 'index'");
                yield Intent.selectVisible(state, msg.index());
            }
            case KEYDOWN -> {
                if (msg.keyCode() == null) throw new IntentDecodeException("'keydown' requiere 'keyCode'");
                yield DomEvents.isConfirmKey(msg.keyCode())
                        ? Optional.of(Intent.confirm())
                        : Optional.empty();
            }
            default -> throw new IntentDecodeException("Tipo de intención desconocido: " + msg.type());
        };
    }
}
