package com.pgschema.core.query;

import com.pgschema.core.ExecutionFailedException;
import com.pgschema.core.MalformedRestrictionException;
import com.pgschema.core.UnknownCollectionException;
import com.pgschema.core.catalog.CollectionCatalog;
import com.pgschema.core.catalog.CollectionSummary;
import com.pgschema.core.catalog.ReservedWords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class CollectionQueryEngineTest {

    private StatementExecutor     executor;
    private CollectionQueryEngine engine;

    @BeforeEach
    void setUp() {
        executor = mock(StatementExecutor.class);
        engine   = new CollectionQueryEngine(executor);
    }

    @Test
    void fetchBindsRestrictionsAndProjectsRows() throws Exception {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("TABLE_TYPE", "BASE TABLE");
        raw.put("table_name", "orders");
        raw.put("TABLE_SCHEMA", "public");
        raw.put("table_catalog", "shop");
        raw.put("unexpected", 42);
        when(executor.execute(any())).thenReturn(List.of(raw));

        CollectionResult result = engine.fetch("Tables", RestrictionSet.of("", "public", "", ""));

        ArgumentCaptor<BoundStatement> captor = ArgumentCaptor.forClass(BoundStatement.class);
        verify(executor).execute(captor.capture());
        BoundStatement st = captor.getValue();
        assertTrue(st.getText().endsWith(" WHERE table_schema = :table_schema"));
        assertEquals(List.of(new BoundStatement.Parameter("table_schema", "public")), st.getParameters());

        assertEquals("Tables", result.getCollectionName());
        assertEquals(List.of("table_catalog", "table_schema", "table_name", "table_type"), result.getColumnNames());
        assertEquals(1, result.getRowCount());
        Map<String, Object> row = result.getRows().get(0);
        assertEquals(List.of("table_catalog", "table_schema", "table_name", "table_type"), List.copyOf(row.keySet()));
        assertEquals("shop", row.get("table_catalog"));
        assertEquals("public", row.get("table_schema"));
        assertEquals("orders", row.get("table_name"));
        assertEquals("BASE TABLE", row.get("table_type"));
    }

    @Test
    void fetchWithoutRestrictionsRunsTheTemplateAsIs() throws Exception {
        when(executor.execute(any())).thenReturn(List.of());
        String template = engine.getCatalog().resolve("Views").getQueryTemplate();

        CollectionResult result = engine.fetch("Views", RestrictionSet.of("", null, ""));

        ArgumentCaptor<BoundStatement> captor = ArgumentCaptor.forClass(BoundStatement.class);
        verify(executor).execute(captor.capture());
        assertEquals(template, captor.getValue().getText());
        assertTrue(captor.getValue().getParameters().isEmpty());
        assertEquals(0, result.getRowCount());
        assertEquals(5, result.getColumns().size());
    }

    @Test
    void coercesValuesToDeclaredTypes() throws Exception {
        Map<String, Object> raw = new HashMap<>();
        raw.put("user_name", "postgres");
        raw.put("user_sysid", 10);
        when(executor.execute(any())).thenReturn(List.of(raw));

        CollectionResult users = engine.fetch("Users", "postgres");

        assertEquals(10L, users.getRows().get(0).get("user_sysid"));
        assertInstanceOf(Long.class, users.getRows().get(0).get("user_sysid"));
    }

    @Test
    void unsignedOidsKeepTheirValue() throws Exception {
        when(executor.execute(any())).thenReturn(
                List.of(Map.of("user_name", "etl", "user_sysid", 3_000_000_000L)));

        CollectionResult users = engine.fetch("Users");

        assertEquals(3_000_000_000L, users.getRows().get(0).get("user_sysid"));
    }

    @Test
    void valuesThatWouldBeTruncatedFail() throws Exception {
        when(executor.execute(any())).thenReturn(
                List.of(Map.of("column_name", "price", "ordinal_position", new BigDecimal("2.5"))));

        ExecutionFailedException e = assertThrows(ExecutionFailedException.class, () -> engine.fetch("Columns"));
        assertTrue(e.getMessage().contains("ordinal_position"));
    }

    @Test
    void missingColumnsProjectAsNull() throws Exception {
        when(executor.execute(any())).thenReturn(List.of(Map.of("database_name", "postgres")));

        Map<String, Object> row = engine.fetch("Databases").getRows().get(0);

        assertEquals("postgres", row.get("database_name"));
        assertTrue(row.containsKey("owner"));
        assertNull(row.get("owner"));
        assertNull(row.get("encoding"));
    }

    @Test
    void unknownCollectionFailsBeforeAnyExecution() {
        UnknownCollectionException e = assertThrows(UnknownCollectionException.class,
                () -> engine.fetch("Sequences", RestrictionSet.of("x")));
        assertEquals("Sequences", e.getCollectionName());
        verifyNoInteractions(executor);
    }

    @Test
    void lookupIsCaseSensitive() {
        assertThrows(UnknownCollectionException.class, () -> engine.fetch("tables"));
        verifyNoInteractions(executor);
    }

    @Test
    void executorFailureIsWrapped() throws Exception {
        SQLException cause = new SQLException("permission denied for relation pg_authid", "42501");
        when(executor.execute(any())).thenThrow(cause);

        ExecutionFailedException e = assertThrows(ExecutionFailedException.class, () -> engine.fetch("Users"));

        assertSame(cause, e.getCause());
        assertTrue(e.getMessage().contains("permission denied for relation pg_authid"));
    }

    @Test
    void rowsThatDoNotFitTheSchemaFail() throws Exception {
        when(executor.execute(any())).thenReturn(
                List.of(Map.of("user_name", "postgres", "user_sysid", "not-a-number")));

        ExecutionFailedException e = assertThrows(ExecutionFailedException.class, () -> engine.fetch("Users"));
        assertTrue(e.getMessage().contains("user_sysid"));
    }

    @Test
    void reservedWordsAreServedFromMemoryAndIgnoreRestrictions() throws Exception {
        CollectionResult first  = engine.fetch("ReservedWords");
        CollectionResult second = engine.fetch("ReservedWords", RestrictionSet.of("SELECT", "x", "y"));

        verifyNoInteractions(executor);
        assertEquals(List.of(ReservedWords.COLUMN), first.getColumnNames());
        assertEquals(ReservedWords.all(), first.column(ReservedWords.COLUMN));
        assertEquals(first.getRows(), second.getRows());
        assertTrue(first.column(ReservedWords.COLUMN).contains("WHERE"));
    }

    @Test
    void metaDataCollectionsDescribeTheCatalog() throws Exception {
        CollectionResult result = engine.fetch("MetaDataCollections");

        assertEquals(engine.getCatalog().size(), result.getRowCount());
        Map<String, Object> tables = result.getRows().stream()
                .filter(r -> "Tables".equals(r.get("CollectionName")))
                .findFirst()
                .orElseThrow();
        assertEquals(4, tables.get("NumberOfRestrictions"));
        assertEquals(3, tables.get("NumberOfIdentifierParts"));
        verifyNoInteractions(executor);
    }

    @Test
    void restrictionsCollectionListsPositions() throws Exception {
        CollectionResult result = engine.fetch("Restrictions");

        List<Map<String, Object>> indexColumns = result.getRows().stream()
                .filter(r -> "IndexColumns".equals(r.get("CollectionName")))
                .toList();
        assertEquals(5, indexColumns.size());
        assertEquals("column_name", indexColumns.get(4).get("RestrictionName"));
        assertEquals(5, indexColumns.get(4).get("RestrictionNumber"));
    }

    @Test
    void strictEngineRejectsOverlongRestrictions() throws Exception {
        CollectionQueryEngine strict = new CollectionQueryEngine(CollectionCatalog.builtin(), executor,
                EngineConfig.builder().restrictionMode(RestrictionMode.STRICT).build());

        assertThrows(MalformedRestrictionException.class, () -> strict.fetch("Users", "postgres", "extra"));
        verify(executor, never()).execute(any());
    }

    @Test
    void listCollectionsIsStable() {
        List<CollectionSummary> first  = engine.listCollections();
        List<CollectionSummary> second = engine.listCollections();

        assertEquals(first.stream().map(CollectionSummary::getName).toList(),
                     second.stream().map(CollectionSummary::getName).toList());
        assertEquals("MetaDataCollections", first.get(0).getName());
        CollectionSummary tables = first.stream()
                .filter(s -> s.getName().equals("Tables"))
                .findFirst()
                .orElseThrow();
        assertEquals(List.of("table_catalog", "table_schema", "table_name", "table_type"),
                     tables.getRestrictionColumns());
    }

    @Test
    void concurrentFetchesDoNotShareStatements() throws Exception {
        when(executor.execute(any())).thenAnswer(inv -> {
            BoundStatement st = inv.getArgument(0);
            return List.of(Map.of("table_name", st.valueOf("table_name")));
        });

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> calls = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                String name = "t" + i;
                calls.add(() -> (String) engine.fetch("Tables", null, null, name)
                        .getRows().get(0).get("table_name"));
            }
            List<Future<String>> futures = pool.invokeAll(calls);
            for (int i = 0; i < futures.size(); i++) {
                assertEquals("t" + i, futures.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
