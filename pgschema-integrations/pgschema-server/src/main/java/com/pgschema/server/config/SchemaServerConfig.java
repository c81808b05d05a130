package com.pgschema.server.config;

import com.pgschema.core.query.RestrictionMode;

import java.util.Locale;
import java.util.Properties;

/**
 * Immutable configuration for {@link com.pgschema.server.SchemaServer}.
 *
 * Build with the nested {@link Builder}:
 * <pre>
 *   SchemaServerConfig config = SchemaServerConfig.builder()
 *       .port(8080)
 *       .path("/collections")
 *       .restrictionMode(RestrictionMode.STRICT)
 *       .build();
 * </pre>
 *
 * or read it from a properties file with {@link #fromProperties(Properties)}.
 */
public final class SchemaServerConfig {

    public static final String PORT             = "pgschema.server.port";
    public static final String PATH             = "pgschema.server.path";
    public static final String MAX_THREADS      = "pgschema.server.maxThreads";
    public static final String RESTRICTION_MODE = "pgschema.restrictionMode";
    public static final String JDBC_URL         = "pgschema.jdbc.url";

    /** Every {@code pgschema.jdbc.*} key other than the URL is a JDBC connection property. */
    public static final String JDBC_PREFIX = "pgschema.jdbc.";

    private final int             port;
    private final String          path;
    private final int             maxThreads;
    private final RestrictionMode restrictionMode;

    private SchemaServerConfig(Builder b) {
        this.port            = b.port;
        this.path            = b.path;
        this.maxThreads      = b.maxThreads;
        this.restrictionMode = b.restrictionMode;
    }

    public int             getPort()            { return port; }
    public String          getPath()            { return path; }
    public int             getMaxThreads()      { return maxThreads; }
    public RestrictionMode getRestrictionMode() { return restrictionMode; }

    /**
     * Reads the server settings from {@code pgschema.server.*} and
     * {@code pgschema.restrictionMode}. Missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static SchemaServerConfig fromProperties(Properties props) {
        Builder b = builder();
        String port = props.getProperty(PORT);
        if (port != null) b.port(parseInt(PORT, port));
        String path = props.getProperty(PATH);
        if (path != null) b.path(path.trim());
        String maxThreads = props.getProperty(MAX_THREADS);
        if (maxThreads != null) b.maxThreads(parseInt(MAX_THREADS, maxThreads));
        String mode = props.getProperty(RESTRICTION_MODE);
        if (mode != null) {
            try {
                b.restrictionMode(RestrictionMode.valueOf(mode.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid value for '" + RESTRICTION_MODE + "': " + mode, e);
            }
        }
        try {
            return b.build();
        } catch (IllegalStateException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    /**
     * The JDBC connection properties among {@code props}: every
     * {@code pgschema.jdbc.*} key except {@value #JDBC_URL}, with the prefix
     * stripped ({@code pgschema.jdbc.user} becomes {@code user}).
     */
    public static Properties jdbcProperties(Properties props) {
        Properties jdbc = new Properties();
        for (String key : props.stringPropertyNames()) {
            if (key.startsWith(JDBC_PREFIX) && !key.equals(JDBC_URL)) {
                jdbc.setProperty(key.substring(JDBC_PREFIX.length()), props.getProperty(key));
            }
        }
        return jdbc;
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + value, e);
        }
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private int             port            = 8080;
        private String          path            = "/collections";
        private int             maxThreads      = 10;
        private RestrictionMode restrictionMode = RestrictionMode.PERMISSIVE;

        public Builder port(int port)                            { this.port = port; return this; }
        public Builder path(String path)                         { this.path = path; return this; }
        public Builder maxThreads(int maxThreads)                { this.maxThreads = maxThreads; return this; }
        public Builder restrictionMode(RestrictionMode mode)     { this.restrictionMode = mode; return this; }

        public SchemaServerConfig build() {
            if (port < 0 || port > 65535) {
                throw new IllegalStateException("port must be between 0 and 65535 but was " + port);
            }
            if (path == null || !path.startsWith("/") || (path.length() > 1 && path.endsWith("/"))) {
                throw new IllegalStateException("path must start with '/' and not end with one: " + path);
            }
            // Jetty needs a few threads for its acceptor and selector
            if (maxThreads < 4) {
                throw new IllegalStateException("maxThreads must be >= 4 but was " + maxThreads);
            }
            if (restrictionMode == null) {
                throw new IllegalStateException("restrictionMode is required");
            }
            return new SchemaServerConfig(this);
        }
    }
}
