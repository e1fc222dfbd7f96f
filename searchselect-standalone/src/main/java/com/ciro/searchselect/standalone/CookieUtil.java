package com.ciro.searchselect.standalone;

import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

public final class CookieUtil {

    private CookieUtil() {}

    public static String getCookie(HttpServerExchange exchange, String name) {
        return parse(exchange.getRequestHeaders().getFirst(Headers.COOKIE), name);
    }

    /** parsing simple: "a=b; c=d" */
    static String parse(String cookieHeader, String name) {
        if (cookieHeader == null) return null;

        for (String p : cookieHeader.split(";")) {
            String s = p.trim();
            int idx = s.indexOf('=');
            if (idx <= 0) continue;
            String k = s.substring(0, idx).trim();
            String v = s.substring(idx + 1).trim();
            if (name.equals(k)) return v;
        }
        return null;
    }

    public static void setCookie(HttpServerExchange exchange, String name, String value) {
        // Path=/ para que aplique también a /intent
        String cookie = name + "=" + value + "; Path=/; HttpOnly; SameSite=Lax";
        exchange.getResponseHeaders().add(Headers.SET_COOKIE, cookie);
    }
}
