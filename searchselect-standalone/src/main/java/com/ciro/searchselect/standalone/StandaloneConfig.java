package com.ciro.searchselect.standalone;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Configuración del host. Se lee de {@code searchselect.properties} (classpath)
 * y se puede pisar con {@code -Dsearchselect.<clave>=...}.
 */
public class StandaloneConfig {

    public static final String PREFIX = "searchselect.";
    public static final String RESOURCE = "searchselect.properties";

    /** Puerto HTTP */
    private int port = 8080;
    /** Interfaz de escucha */
    private String host = "0.0.0.0";
    /** Minutos sin actividad antes de descartar el estado de un widget */
    private int sessionTtlMinutes = 30;
    /** Máximo de widgets vivos (sesión x widget) en memoria */
    private long maxWidgets = 10_000;
    /** Intenciones por segundo y sesión */
    private int intentsPerSecond = 60;

    public static StandaloneConfig load() {
        Properties props = new Properties();
        try (InputStream in = StandaloneConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) props.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("No se pudo leer " + RESOURCE, e);
        }
        // -D gana sobre el fichero
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(PREFIX)) props.setProperty(name, System.getProperty(name));
        }
        return from(props);
    }

    public static StandaloneConfig from(Properties props) {
        StandaloneConfig cfg = new StandaloneConfig();
        cfg.setPort(intProp(props, "port", cfg.port));
        cfg.setHost(props.getProperty(PREFIX + "host", cfg.host).trim());
        cfg.setSessionTtlMinutes(intProp(props, "session-ttl-minutes", cfg.sessionTtlMinutes));
        cfg.setMaxWidgets(longProp(props, "max-widgets", cfg.maxWidgets));
        cfg.setIntentsPerSecond(intProp(props, "intents-per-second", cfg.intentsPerSecond));
        return cfg;
    }

    private static int intProp(Properties props, String key, int def) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valor inválido para " + PREFIX + key + ": '" + raw + "'", e);
        }
    }

    private static long longProp(Properties props, String key, long def) {
        String raw = props.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) return def;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Valor inválido para " + PREFIX + key + ": '" + raw + "'", e);
        }
    }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getSessionTtlMinutes() { return sessionTtlMinutes; }
    public void setSessionTtlMinutes(int sessionTtlMinutes) { this.sessionTtlMinutes = sessionTtlMinutes; }

    public long getMaxWidgets() { return maxWidgets; }
    public void setMaxWidgets(long maxWidgets) { this.maxWidgets = maxWidgets; }

    public int getIntentsPerSecond() { return intentsPerSecond; }
    public void setIntentsPerSecond(int intentsPerSecond) { this.intentsPerSecond = intentsPerSecond; }

    @Override
    public String toString() {
        return "StandaloneConfig{port=" + port + ", host=" + host
                + ", sessionTtlMinutes=" + sessionTtlMinutes
                + ", maxWidgets=" + maxWidgets
                + ", intentsPerSecond=" + intentsPerSecond + "}";
    }
}
