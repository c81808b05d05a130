package com.pgschema.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgschema.core.ExecutionFailedException;
import com.pgschema.core.MalformedRestrictionException;
import com.pgschema.core.SchemaQueryException;
import com.pgschema.core.UnknownCollectionException;
import com.pgschema.core.catalog.CollectionCatalog;
import com.pgschema.core.catalog.CollectionSummary;
import com.pgschema.core.catalog.ResultColumn;
import com.pgschema.core.query.CollectionQueryEngine;
import com.pgschema.core.query.CollectionResult;
import com.pgschema.core.query.EngineConfig;
import com.pgschema.core.query.RestrictionSet;
import com.pgschema.core.query.StatementExecutor;
import com.pgschema.server.config.SchemaServerConfig;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Embedded Jetty HTTP server exposing the metadata collections as JSON.
 *
 * <h2>Endpoints</h2>
 * <pre>
 *   GET {path}                                        list of {name, restrictions}
 *   GET {path}/{collection}?restriction=..&amp;restriction=..   {collection, columns, rows}
 * </pre>
 * Restrictions are positional: the n-th {@code restriction} parameter filters
 * on the n-th restriction column of the collection, and an empty value keeps
 * its slot without filtering.
 *
 * <h2>Usage</h2>
 * <pre>
 *   SchemaServerConfig config = SchemaServerConfig.builder()
 *       .port(8080)
 *       .path("/collections")
 *       .build();
 *
 *   SchemaServer server = new SchemaServer(config, new JdbcStatementExecutor(jdbcConfig));
 *   server.start();
 *   // ... application runs ...
 *   server.stop();
 * </pre>
 */
public class SchemaServer {

    private static final Logger log = LoggerFactory.getLogger(SchemaServer.class);
    private static final String JSON = "application/json";

    private final SchemaServerConfig    config;
    private final CollectionQueryEngine engine;
    private final ObjectMapper          mapper = new ObjectMapper();

    private Server          jettyServer;
    private ServerConnector connector;

    /** Serves the built-in collections through {@code executor}. */
    public SchemaServer(SchemaServerConfig config, StatementExecutor executor) {
        this(config, new CollectionQueryEngine(
                CollectionCatalog.builtin(),
                executor,
                EngineConfig.builder().restrictionMode(config.getRestrictionMode()).build()));
    }

    public SchemaServer(SchemaServerConfig config, CollectionQueryEngine engine) {
        this.config = config;
        this.engine = engine;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    public void start() throws Exception {
        QueuedThreadPool pool = new QueuedThreadPool(config.getMaxThreads(), 2);
        pool.setName("pgschema-http");
        jettyServer = new Server(pool);

        // one acceptor and one selector keep small pools usable on many-core hosts
        connector = new ServerConnector(jettyServer, 1, 1);
        connector.setPort(config.getPort());
        jettyServer.addConnector(connector);

        ServletContextHandler ctx = new ServletContextHandler();
        ctx.setContextPath("/");
        String mapping = config.getPath().equals("/") ? "/*" : config.getPath() + "/*";
        ctx.addServlet(new ServletHolder(new CollectionServlet()), mapping);
        jettyServer.setHandler(ctx);

        jettyServer.start();
        log.info("Schema server listening on port {} at path {} ({} collections, {} restrictions)",
                getPort(), config.getPath(), engine.getCatalog().size(), config.getRestrictionMode());
    }

    public void stop() throws Exception {
        if (jettyServer != null) {
            jettyServer.stop();
            log.info("Schema server stopped");
        }
    }

    /** Blocks until the server has stopped. */
    public void join() throws InterruptedException {
        if (jettyServer != null) {
            jettyServer.join();
        }
    }

    /** The bound port; differs from the configured one when that was 0. */
    public int getPort() {
        return connector != null ? connector.getLocalPort() : config.getPort();
    }

    // ------------------------------------------------------------------
    // Internal servlet
    // ------------------------------------------------------------------

    private class CollectionServlet extends HttpServlet {

        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            String pathInfo = req.getPathInfo();
            String name = pathInfo == null ? "" : pathInfo.substring(1);

            if (name.isEmpty()) {
                writeJson(resp, HttpServletResponse.SC_OK, listing());
                return;
            }
            if (name.contains("/")) {
                writeError(resp, HttpServletResponse.SC_NOT_FOUND, "not_found", "No resource at " + pathInfo);
                return;
            }

            String[] values = req.getParameterValues("restriction");
            RestrictionSet restrictions = values == null
                    ? RestrictionSet.empty()
                    : RestrictionSet.of(Arrays.asList(values));

            try {
                CollectionResult result = engine.fetch(name, restrictions);
                log.debug("Served {} rows of {}", result.getRowCount(), name);
                writeJson(resp, HttpServletResponse.SC_OK, toJson(result));
            } catch (UnknownCollectionException e) {
                writeError(resp, HttpServletResponse.SC_NOT_FOUND, "unknown_collection", e.getMessage());
            } catch (MalformedRestrictionException e) {
                log.warn("Rejected {} restrictions for {}: {}", restrictions.size(), name, e.getMessage());
                writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "malformed_restriction", e.getMessage());
            } catch (ExecutionFailedException e) {
                log.error("Query for collection {} failed", name, e);
                writeError(resp, HttpServletResponse.SC_BAD_GATEWAY, "execution_failed", e.getMessage());
            } catch (SchemaQueryException e) {
                log.error("Unexpected failure serving collection {}", name, e);
                writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "internal_error", e.getMessage());
            }
        }
    }

    private List<Map<String, Object>> listing() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (CollectionSummary summary : engine.listCollections()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", summary.getName());
            entry.put("restrictions", summary.getRestrictionColumns());
            out.add(entry);
        }
        return out;
    }

    private static Map<String, Object> toJson(CollectionResult result) {
        List<Map<String, Object>> columns = new ArrayList<>();
        for (ResultColumn column : result.getColumns()) {
            Map<String, Object> c = new LinkedHashMap<>();
            c.put("name", column.getName());
            c.put("type", column.getType().name());
            columns.add(c);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("collection", result.getCollectionName());
        body.put("columns", columns);
        body.put("rows", result.getRows());
        return body;
    }

    private void writeError(HttpServletResponse resp, int status, String error, String message) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        writeJson(resp, status, body);
    }

    private void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
        resp.setStatus(status);
        resp.setContentType(JSON);
        resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
        mapper.writeValue(resp.getOutputStream(), body);
    }
}
