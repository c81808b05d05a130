package com.pgschema.jdbc;

import java.sql.SQLException;
import java.util.Locale;
import java.util.Properties;

/**
 * Connection settings for {@link JdbcStatementExecutor}.
 *
 * <p>The JDBC URL is handed to the driver verbatim. Of the supplied
 * properties, {@code queryTimeout} (seconds, 0 = none) and {@code fetchSize}
 * are consumed by the executor; everything else, including {@code user} and
 * {@code password}, is forwarded to the driver on connect.
 */
public final class JdbcExecutorConfig {

    private final String     url;
    private final Properties driverProperties;
    private final int        queryTimeoutSeconds;
    private final int        fetchSize;

    private JdbcExecutorConfig(Builder b) {
        this.url                 = b.url;
        this.driverProperties    = b.driverProperties;
        this.queryTimeoutSeconds = b.queryTimeoutSeconds;
        this.fetchSize           = b.fetchSize;
    }

    /**
     * Parses a JDBC URL and connection properties.
     *
     * @param url  any {@code jdbc:} URL, e.g. {@code jdbc:postgresql://db:5432/app}
     * @param info connection properties; may be {@code null}
     * @throws SQLException if the URL is not a JDBC URL or a numeric setting is invalid
     */
    public static JdbcExecutorConfig parse(String url, Properties info) throws SQLException {
        if (url == null || !url.startsWith("jdbc:")) {
            throw new SQLException("Invalid JDBC URL: " + url + "\nExpected: jdbc:<subprotocol>:<subname>");
        }

        Builder b = builder(url);
        if (info != null) {
            for (String key : info.stringPropertyNames()) {
                String value = info.getProperty(key);
                try {
                    switch (key.toLowerCase(Locale.ROOT)) {
                        case "querytimeout" -> b.queryTimeoutSeconds(Integer.parseInt(value.trim()));
                        case "fetchsize"    -> b.fetchSize(Integer.parseInt(value.trim()));
                        default             -> b.driverProperty(key, value);
                    }
                } catch (NumberFormatException e) {
                    throw new SQLException("Invalid value for '" + key + "': " + value, e);
                }
            }
        }
        try {
            return b.build();
        } catch (IllegalStateException e) {
            throw new SQLException(e.getMessage(), e);
        }
    }

    public String getUrl()                 { return url; }
    public int    getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
    public int    getFetchSize()           { return fetchSize; }

    /** A copy of the properties passed to the driver on connect. */
    public Properties getDriverProperties() {
        Properties copy = new Properties();
        copy.putAll(driverProperties);
        return copy;
    }

    public String getUser() { return driverProperties.getProperty("user", ""); }

    @Override
    public String toString() {
        return "JdbcExecutorConfig{url='" + url + "', user='" + getUser() + "', queryTimeout=" +
               queryTimeoutSeconds + "s, fetchSize=" + fetchSize + '}';
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public static final class Builder {
        private final String     url;
        private final Properties driverProperties = new Properties();
        private int queryTimeoutSeconds = 30;
        private int fetchSize           = 1000;

        private Builder(String url) {
            this.url = url;
        }

        public Builder user(String user)                      { return driverProperty("user", user); }
        public Builder password(String password)              { return driverProperty("password", password); }
        public Builder queryTimeoutSeconds(int seconds)       { this.queryTimeoutSeconds = seconds; return this; }
        public Builder fetchSize(int rows)                    { this.fetchSize = rows; return this; }

        public Builder driverProperty(String key, String value) {
            if (value != null) driverProperties.setProperty(key, value);
            return this;
        }

        public JdbcExecutorConfig build() {
            if (url == null || url.isBlank()) {
                throw new IllegalStateException("url is required");
            }
            if (queryTimeoutSeconds < 0) {
                throw new IllegalStateException("queryTimeout must be >= 0 but was " + queryTimeoutSeconds);
            }
            if (fetchSize < 0) {
                throw new IllegalStateException("fetchSize must be >= 0 but was " + fetchSize);
            }
            return new JdbcExecutorConfig(this);
        }
    }
}
