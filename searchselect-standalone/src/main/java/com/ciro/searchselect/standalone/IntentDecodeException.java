package com.ciro.searchselect.standalone;

/** Mensaje del cliente que no se puede traducir a una intención. */
public class IntentDecodeException extends Exception {

    public IntentDecodeException(String message) {
        super(message);
    }
}
