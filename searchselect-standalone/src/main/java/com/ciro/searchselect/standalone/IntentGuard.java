package com.ciro.searchselect.standalone;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate-limit de intenciones por sesión + sobres de error JSON.
 * <p>
 * Los buckets viven en Caffeine: si la sesión deja de escribir en 1h se liberan.
 */
public final class IntentGuard {

    private static final Duration DEFAULT_WINDOW = Duration.ofSeconds(1);

    private final Cache<String, Bucket> buckets = Caffeine.newBuilder()
            .expireAfterAccess(Duration.ofHours(1))
            .maximumSize(50_000)
            .build();

    private final int rate;
    private final Duration window;
    private final ObjectMapper mapper;

    public IntentGuard(int ratePerSecond, ObjectMapper mapper) {
        this(ratePerSecond, DEFAULT_WINDOW, mapper);
    }

    /** {@code rate} intenciones por {@code window}, con recarga gradual. */
    public IntentGuard(int rate, Duration window, ObjectMapper mapper) {
        if (rate <= 0) throw new IllegalArgumentException("rate debe ser > 0");
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window debe ser > 0");
        }
        this.rate = rate;
        this.window = window;
        this.mapper = mapper;
    }

    /* true si todavía está dentro del límite */
    public boolean tryConsume(String key) {
        Bucket b = buckets.get(key, k ->
             Bucket.builder()
                   .addLimit(Bandwidth.builder()
                           .capacity(rate)
                           .refillGreedy(rate, window)
                           .build())
                   .build()
        );
        return b.tryConsume(1);
    }

    public String errorJson(String code, String msg) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("code", code);
        body.put("error", msg == null ? "" : msg);
        try {
            return mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return "{\"ok\":false,\"code\":\"" + code + "\",\"error\":\"\"}";
        }
    }
}
