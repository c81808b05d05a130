package com.pgschema.server;

import com.pgschema.jdbc.JdbcExecutorConfig;
import com.pgschema.jdbc.JdbcStatementExecutor;
import com.pgschema.server.config.SchemaServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Starts a {@link SchemaServer} backed by JDBC.
 *
 * <p>Settings come from the properties file named by the first argument, or
 * from {@code pgschema.properties} on the classpath.
 */
public final class SchemaServerMain {

    private static final Logger log = LoggerFactory.getLogger(SchemaServerMain.class);
    private static final String DEFAULT_RESOURCE = "/pgschema.properties";

    private SchemaServerMain() {}

    public static void main(String[] args) throws Exception {
        Properties props = load(args.length > 0 ? args[0] : null);

        SchemaServerConfig serverConfig = SchemaServerConfig.fromProperties(props);
        JdbcExecutorConfig jdbcConfig = JdbcExecutorConfig.parse(
                props.getProperty(SchemaServerConfig.JDBC_URL),
                SchemaServerConfig.jdbcProperties(props));
        log.info("Using {}", jdbcConfig);

        SchemaServer server = new SchemaServer(serverConfig, new JdbcStatementExecutor(jdbcConfig));
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.stop();
            } catch (Exception e) {
                log.error("Failed to stop schema server", e);
            }
        }, "pgschema-shutdown"));

        server.start();
        server.join();
    }

    static Properties load(String file) throws IOException {
        Properties props = new Properties();
        if (file != null) {
            try (InputStream in = Files.newInputStream(Path.of(file))) {
                props.load(in);
            }
            log.info("Loaded configuration from {}", file);
            return props;
        }
        try (InputStream in = SchemaServerMain.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new FileNotFoundException("No configuration file given and " + DEFAULT_RESOURCE + " is not on the classpath");
            }
            props.load(in);
        }
        log.info("Loaded configuration from classpath {}", DEFAULT_RESOURCE);
        return props;
    }
}
