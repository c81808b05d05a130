package com.pgschema.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgschema.core.query.BoundStatement;
import com.pgschema.core.query.RestrictionMode;
import com.pgschema.core.query.StatementExecutor;
import com.pgschema.server.config.SchemaServerConfig;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SchemaServerTest {

    private final ObjectMapper      mapper   = new ObjectMapper();
    private final StatementExecutor executor = mock(StatementExecutor.class);

    private final CloseableHttpClient http = HttpClients.createDefault();

    private SchemaServer server;

    @AfterEach
    void stopServer() throws Exception {
        http.close();
        if (server != null) {
            server.stop();
        }
    }

    private void start(RestrictionMode mode) throws Exception {
        SchemaServerConfig config = SchemaServerConfig.builder()
                .port(0)
                .path("/collections")
                .restrictionMode(mode)
                .build();
        server = new SchemaServer(config, executor);
        server.start();
    }

    @Test
    void listsCollectionsInRegistrationOrder() throws Exception {
        start(RestrictionMode.PERMISSIVE);

        Response resp = get("/collections");

        assertEquals(200, resp.status);
        assertEquals(11, resp.body.size());
        assertEquals("MetaDataCollections", resp.body.get(0).get("name").asText());
        JsonNode tables = resp.body.get(5);
        assertEquals("Tables", tables.get("name").asText());
        assertEquals("table_schema", tables.get("restrictions").get(1).asText());
        verifyNoInteractions(executor);
    }

    @Test
    void fetchesWithPositionalRestrictions() throws Exception {
        when(executor.execute(any())).thenReturn(List.of(
                Map.of("TABLE_CATALOG", "app", "TABLE_SCHEMA", "public", "TABLE_NAME", "orders",
                        "TABLE_TYPE", "BASE TABLE")));
        start(RestrictionMode.PERMISSIVE);

        Response resp = get("/collections/Tables?restriction=&restriction=public&restriction=&restriction=");

        assertEquals(200, resp.status);
        assertEquals("Tables", resp.body.get("collection").asText());
        assertEquals("STRING", resp.body.get("columns").get(0).get("type").asText());
        assertEquals("orders", resp.body.get("rows").get(0).get("table_name").asText());

        ArgumentCaptor<BoundStatement> captor = ArgumentCaptor.forClass(BoundStatement.class);
        verify(executor).execute(captor.capture());
        BoundStatement statement = captor.getValue();
        assertTrue(statement.getText().endsWith(" WHERE table_schema = :table_schema"));
        assertEquals("public", statement.valueOf("table_schema"));
    }

    @Test
    void servesStaticCollectionsWithoutTheStore() throws Exception {
        start(RestrictionMode.PERMISSIVE);

        Response resp = get("/collections/ReservedWords?restriction=ignored");

        assertEquals(200, resp.status);
        assertEquals("ReservedWord", resp.body.get("columns").get(0).get("name").asText());
        assertTrue(resp.body.get("rows").size() > 90);
        verifyNoInteractions(executor);
    }

    @Test
    void unknownCollectionIsNotFound() throws Exception {
        start(RestrictionMode.PERMISSIVE);

        Response resp = get("/collections/Sequences");

        assertEquals(404, resp.status);
        assertEquals("unknown_collection", resp.body.get("error").asText());
        assertTrue(resp.body.get("message").asText().contains("Sequences"));
        verifyNoInteractions(executor);
    }

    @Test
    void surplusRestrictionsAreBadRequestsInStrictMode() throws Exception {
        start(RestrictionMode.STRICT);

        Response resp = get("/collections/Databases?restriction=app&restriction=extra");

        assertEquals(400, resp.status);
        assertEquals("malformed_restriction", resp.body.get("error").asText());
        verifyNoInteractions(executor);
    }

    @Test
    void storeFailuresAreBadGateway() throws Exception {
        when(executor.execute(any())).thenThrow(new SQLException("connection refused"));
        start(RestrictionMode.PERMISSIVE);

        Response resp = get("/collections/Users");

        assertEquals(502, resp.status);
        assertEquals("execution_failed", resp.body.get("error").asText());
        assertTrue(resp.body.get("message").asText().contains("connection refused"));
    }

    // ------------------------------------------------------------------

    private static final class Response {
        final int      status;
        final JsonNode body;

        Response(int status, JsonNode body) {
            this.status = status;
            this.body   = body;
        }
    }

    private Response get(String pathAndQuery) throws IOException {
        HttpGet get = new HttpGet("http://localhost:" + server.getPort() + pathAndQuery);
        get.setHeader("Accept", "application/json");
        return http.execute(get, response ->
                new Response(response.getCode(), mapper.readTree(EntityUtils.toString(response.getEntity()))));
    }
}
