package com.ciro.searchselect.dom;

/**
 * Contrato entre el HTML que genera la vista y el runtime JS del navegador.
 */
public final class DomEvents {

    private DomEvents() {}

    /** Enter en el input de búsqueda. */
    public static final int ENTER_KEY_CODE = 13;

    /* atributos */
    public static final String ATTR_WIDGET  = "data-widget";
    public static final String ATTR_INTENT  = "data-intent";
    public static final String ATTR_INDEX   = "data-index";
    /** preventDefault + stopPropagation en el click */
    public static final String ATTR_PREVENT = "data-prevent";

    /* nombres de intención en el cable */
    public static final String TOGGLE  = "toggle";
    public static final String CLEAR   = "clear";
    public static final String SEARCH  = "search";
    public static final String CONFIRM = "confirm";
    public static final String SELECT  = "select";

    public static boolean isConfirmKey(int keyCode) {
        return keyCode == ENTER_KEY_CODE;
    }
}
