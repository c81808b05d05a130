package com.pgschema.core.query;

import com.pgschema.core.ExecutionFailedException;
import com.pgschema.core.MalformedRestrictionException;
import com.pgschema.core.SchemaQueryException;
import com.pgschema.core.UnknownCollectionException;
import com.pgschema.core.catalog.CollectionCatalog;
import com.pgschema.core.catalog.CollectionDescriptor;
import com.pgschema.core.catalog.CollectionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serves metadata collections by name.
 *
 * <p>A {@link #fetch} call resolves the collection in the
 * {@link CollectionCatalog}, binds the caller's positional restrictions with a
 * {@link RestrictionQueryBuilder}, runs the statement through the injected
 * {@link StatementExecutor} and shapes the returned rows to the collection's
 * declared columns. Static collections ({@code ReservedWords},
 * {@code MetaDataCollections}, ...) are answered from memory and ignore
 * restrictions.
 *
 * <p>The engine keeps no per-call state. Errors are thrown to the caller
 * unchanged in kind and never retried or logged here.
 */
public class CollectionQueryEngine {

    private static final Logger log = LoggerFactory.getLogger(CollectionQueryEngine.class);

    private final CollectionCatalog       catalog;
    private final StatementExecutor       executor;
    private final RestrictionQueryBuilder builder;

    public CollectionQueryEngine(StatementExecutor executor) {
        this(CollectionCatalog.builtin(), executor, EngineConfig.defaults());
    }

    public CollectionQueryEngine(CollectionCatalog catalog, StatementExecutor executor, EngineConfig config) {
        this.catalog  = Objects.requireNonNull(catalog, "catalog");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.builder  = new RestrictionQueryBuilder(config.getRestrictionMode());
    }

    public CollectionCatalog getCatalog() { return catalog; }

    /** Name and restriction columns of every served collection, in stable order. */
    public List<CollectionSummary> listCollections() {
        return catalog.listCollections();
    }

    /**
     * Fetches one collection.
     *
     * @param name         collection name, e.g. {@code "Tables"}
     * @param restrictions positional filter values; {@code null} means none
     * @return the rows, shaped to the collection's declared columns
     * @throws UnknownCollectionException    if {@code name} is not in the catalog
     * @throws MalformedRestrictionException if strict restriction checking rejects {@code restrictions}
     * @throws ExecutionFailedException      if the executor fails or returns values
     *                                       that do not fit the declared column types
     */
    public CollectionResult fetch(String name, RestrictionSet restrictions) throws SchemaQueryException {
        CollectionDescriptor collection = catalog.resolve(name);
        RestrictionSet effective = restrictions == null ? RestrictionSet.empty() : restrictions;

        List<Map<String, Object>> rawRows;
        if (collection.isStatic()) {
            rawRows = collection.getStaticRows();
        } else {
            BoundStatement statement = builder.build(collection, effective);
            log.debug("Fetching '{}': {}", name, statement);
            try {
                rawRows = executor.execute(statement);
            } catch (SQLException e) {
                throw new ExecutionFailedException(
                        "Fetching collection '" + name + "' failed: " + e.getMessage(), e);
            }
        }
        return project(collection, rawRows);
    }

    public CollectionResult fetch(String name, String... restrictions) throws SchemaQueryException {
        return fetch(name, RestrictionSet.of(restrictions));
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private CollectionResult project(CollectionDescriptor collection, List<Map<String, Object>> rawRows)
            throws ExecutionFailedException {
        RowProjector projector = new RowProjector(collection.getResultColumns());
        CollectionResult.Builder result = CollectionResult.builder(collection.getName(), collection.getResultColumns());
        int index = 0;
        for (Map<String, Object> raw : rawRows) {
            try {
                result.row(projector.project(raw));
            } catch (IllegalArgumentException e) {
                throw new ExecutionFailedException("Row " + index + " of collection '" + collection.getName() +
                        "' does not match its schema: " + e.getMessage(), e);
            }
            index++;
        }
        CollectionResult built = result.build();
        log.debug("Collection '{}' returned {} row(s)", collection.getName(), built.getRowCount());
        return built;
    }
}
