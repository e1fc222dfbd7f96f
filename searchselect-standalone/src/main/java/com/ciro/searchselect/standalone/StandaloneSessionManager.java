package com.ciro.searchselect.standalone;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Sesión = cookie {@value #COOKIE_NAME}. El estado de los widgets no vive aquí
 * sino en {@link WidgetStore}, indexado por este id.
 * <p>
 * Una sesión sin requests durante {@code ttlMinutes} se da por terminada y se
 * avisa a {@code onSessionEnd} para que libere lo asociado a ella.
 */
public class StandaloneSessionManager {

    private static final Logger log = LoggerFactory.getLogger(StandaloneSessionManager.class);

    public static final String COOKIE_NAME = "SSID";
    private static final SecureRandom RNG = new SecureRandom();

    private final Cache<String, Boolean> live;

    public StandaloneSessionManager(long ttlMinutes, Consumer<String> onSessionEnd) {
        this(ttlMinutes, Ticker.systemTicker(), onSessionEnd);
    }

    StandaloneSessionManager(long ttlMinutes, Ticker ticker, Consumer<String> onSessionEnd) {
        this.live = Caffeine.newBuilder()
                .expireAfterAccess(ttlMinutes, TimeUnit.MINUTES)
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String sid, Boolean v, RemovalCause cause) -> {
                    log.debug("Sesión {} terminada ({})", sid, cause);
                    onSessionEnd.accept(sid);
                })
                .build();
    }

    public String ensureSession(HttpServerExchange exchange) {
        String sid = exchange.getAttachment(UndertowAttachments.SESSION_ID);
        if (sid != null) return sid;

        sid = CookieUtil.getCookie(exchange, COOKIE_NAME);
        if (sid == null || sid.isBlank()) {
            sid = newId();
            CookieUtil.setCookie(exchange, COOKIE_NAME, sid);
            log.debug("Nueva sesión {}", sid);
        }

        touch(sid);
        // disponible como attachment durante el request
        exchange.putAttachment(UndertowAttachments.SESSION_ID, sid);
        return sid;
    }

    /* marca actividad; una cookie que ya no conocemos vuelve a registrarse */
    void touch(String sid) {
        live.get(sid, k -> Boolean.TRUE);
    }

    /* fuerza el mantenimiento pendiente (expiraciones) */
    void cleanUp() {
        live.cleanUp();
    }

    public void touchNoCache(HttpServerExchange exchange) {
        exchange.getResponseHeaders().put(Headers.CACHE_CONTROL, "no-store, no-cache, must-revalidate, max-age=0");
        exchange.getResponseHeaders().put(Headers.PRAGMA, "no-cache");
    }

    private static String newId() {
        byte[] b = new byte[18];
        RNG.nextBytes(b);
        return Base64Url.encode(b);
    }
}
